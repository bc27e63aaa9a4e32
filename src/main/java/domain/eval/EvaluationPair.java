package domain.eval;

/**
 * One (predicted, gold, db_id) triple of a batch.
 */
public final class EvaluationPair {

    private final int index;
    private final String questionId;
    private final String question;
    private final String predictedSql;
    private final String goldSql;
    private final String dbId;

    public EvaluationPair(int index, String questionId, String question,
                          String predictedSql, String goldSql, String dbId) {
        this.index = index;
        this.questionId = questionId == null ? "" : questionId;
        this.question = question == null ? "" : question;
        this.predictedSql = predictedSql == null ? "" : predictedSql;
        this.goldSql = goldSql == null ? "" : goldSql;
        this.dbId = dbId == null ? "" : dbId.trim();
    }

    public static EvaluationPair of(int index, String predictedSql, String goldSql, String dbId) {
        return new EvaluationPair(index, null, null, predictedSql, goldSql, dbId);
    }

    /** 0-based position in the batch */
    public int getIndex() {
        return index;
    }

    public String getQuestionId() {
        return questionId;
    }

    public String getQuestion() {
        return question;
    }

    public String getPredictedSql() {
        return predictedSql;
    }

    public String getGoldSql() {
        return goldSql;
    }

    public String getDbId() {
        return dbId;
    }
}
