package domain.eval;

import domain.clause.SqlClause;
import domain.difficulty.DifficultyLabel;
import domain.exec.ExecutionResult;
import domain.exec.ResultComparison;
import domain.model.EvaluationWarning;
import domain.score.ClauseScore;

import java.util.List;
import java.util.Map;

/**
 * Everything computed for one pair. Execution fields are null when execution was not requested.
 */
public final class PairResult {

    private final EvaluationPair pair;
    private final AnalyzedQuery predicted;
    private final AnalyzedQuery gold;
    private final boolean exactMatch;
    private final Map<SqlClause, ClauseScore> clauseScores;
    private final double componentF1;
    private final DifficultyLabel difficulty;
    private final List<String> missingKeywords;
    private final List<String> extraKeywords;
    private final ExecutionResult predictedExecution;
    private final ExecutionResult goldExecution;
    private final ResultComparison comparison;
    private final List<EvaluationWarning> warnings;

    PairResult(EvaluationPair pair, AnalyzedQuery predicted, AnalyzedQuery gold, boolean exactMatch,
               Map<SqlClause, ClauseScore> clauseScores, double componentF1, DifficultyLabel difficulty,
               List<String> missingKeywords, List<String> extraKeywords,
               ExecutionResult predictedExecution, ExecutionResult goldExecution,
               ResultComparison comparison, List<EvaluationWarning> warnings) {
        this.pair = pair;
        this.predicted = predicted;
        this.gold = gold;
        this.exactMatch = exactMatch;
        this.clauseScores = Map.copyOf(clauseScores);
        this.componentF1 = componentF1;
        this.difficulty = difficulty;
        this.missingKeywords = List.copyOf(missingKeywords);
        this.extraKeywords = List.copyOf(extraKeywords);
        this.predictedExecution = predictedExecution;
        this.goldExecution = goldExecution;
        this.comparison = comparison;
        this.warnings = List.copyOf(warnings);
    }

    public EvaluationPair getPair() {
        return pair;
    }

    public AnalyzedQuery getPredicted() {
        return predicted;
    }

    public AnalyzedQuery getGold() {
        return gold;
    }

    public boolean isExactMatch() {
        return exactMatch;
    }

    public Map<SqlClause, ClauseScore> getClauseScores() {
        return clauseScores;
    }

    /** Mean of this pair's clause F1 scores. */
    public double getComponentF1() {
        return componentF1;
    }

    public DifficultyLabel getDifficulty() {
        return difficulty;
    }

    /** Gold keywords the prediction lacks; empty for exact matches. */
    public List<String> getMissingKeywords() {
        return missingKeywords;
    }

    /** Predicted keywords gold does not use; empty for exact matches. */
    public List<String> getExtraKeywords() {
        return extraKeywords;
    }

    public boolean isExecuted() {
        return predictedExecution != null && goldExecution != null;
    }

    public ExecutionResult getPredictedExecution() {
        return predictedExecution;
    }

    public ExecutionResult getGoldExecution() {
        return goldExecution;
    }

    public ResultComparison getComparison() {
        return comparison;
    }

    /** True when both sides ran and returned the same row set. */
    public boolean isExecutionMatch() {
        return isExecuted() && predictedExecution.isSuccess() && goldExecution.isSuccess()
                && comparison != null && comparison.isExactMatch();
    }

    public List<EvaluationWarning> getWarnings() {
        return warnings;
    }
}
