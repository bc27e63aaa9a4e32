package infra.input;

/** One gold dataset entry. */
public final class GoldExample {

    private final String questionId;
    private final String question;
    private final String sql;
    private final String dbId;

    public GoldExample(String questionId, String question, String sql, String dbId) {
        this.questionId = questionId == null ? "" : questionId;
        this.question = question == null ? "" : question;
        this.sql = sql == null ? "" : sql;
        this.dbId = dbId == null ? "" : dbId.trim();
    }

    public String getQuestionId() {
        return questionId;
    }

    public String getQuestion() {
        return question;
    }

    public String getSql() {
        return sql;
    }

    public String getDbId() {
        return dbId;
    }
}
