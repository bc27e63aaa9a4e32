package infra.input;

import domain.eval.EvaluationPair;
import domain.model.InvalidEvaluationInputException;

import java.util.ArrayList;
import java.util.List;

/**
 * Zips gold examples with predictions into evaluation pairs.
 */
public final class EvaluationPairAssembler {

    private EvaluationPairAssembler() {
    }

    /**
     * @param max keep at most this many pairs; negative keeps all
     * @throws InvalidEvaluationInputException when the counts differ, or a prediction names a
     *                                         db_id different from its gold entry
     */
    public static List<EvaluationPair> assemble(List<GoldExample> gold, List<Prediction> predictions, int max) {
        if (gold.size() != predictions.size()) {
            throw new InvalidEvaluationInputException("batch length mismatch: gold=" + gold.size()
                    + ", predictions=" + predictions.size());
        }
        int n = max < 0 ? gold.size() : Math.min(max, gold.size());
        List<EvaluationPair> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            GoldExample g = gold.get(i);
            Prediction p = predictions.get(i);
            if (!p.getDbId().isEmpty() && !p.getDbId().equals(g.getDbId())) {
                throw new InvalidEvaluationInputException("prediction " + i + " is for db_id '" + p.getDbId()
                        + "' but gold entry is for '" + g.getDbId() + "'");
            }
            out.add(new EvaluationPair(i, g.getQuestionId(), g.getQuestion(), p.getSql(), g.getSql(), g.getDbId()));
        }
        return out;
    }
}
