package domain.difficulty;

/**
 * Labels a gold query's structural complexity. First matching rule wins:
 * <ol>
 *   <li>extra: subquery, set operation, window, CTE, or join + aggregation + having</li>
 *   <li>hard: join with aggregation or complex WHERE, or aggregation + group by + having</li>
 *   <li>medium: group by, order by, aggregation, or a join without aggregation</li>
 *   <li>easy: everything else</li>
 * </ol>
 */
public final class DifficultyClassifier {

    private DifficultyClassifier() {
    }

    public static DifficultyLabel classify(String sql) {
        return classify(SqlFeatures.detect(sql));
    }

    public static DifficultyLabel classify(SqlFeatures f) {
        if (f.hasSubquery() || f.hasSetOperation() || f.hasWindow() || f.hasCte()
                || (f.hasJoin() && f.hasAggregation() && f.hasHaving())) {
            return DifficultyLabel.EXTRA;
        }
        if ((f.hasJoin() && (f.hasAggregation() || f.hasComplexWhere()))
                || (f.hasAggregation() && f.hasGroupBy() && f.hasHaving())) {
            return DifficultyLabel.HARD;
        }
        if (f.hasGroupBy() || f.hasOrderBy() || f.hasAggregation()
                || (f.hasJoin() && !f.hasAggregation())) {
            return DifficultyLabel.MEDIUM;
        }
        return DifficultyLabel.EASY;
    }
}
