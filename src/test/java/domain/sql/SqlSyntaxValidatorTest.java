package domain.sql;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlSyntaxValidatorTest {

    @Test
    void isValid_shouldAcceptWellFormedSelect() {
        assertTrue(SqlSyntaxValidator.isValid("SELECT a FROM t;"));
        assertTrue(SqlSyntaxValidator.isValid("select * from t where a in (select b from u)"));
        assertTrue(SqlSyntaxValidator.isValid("WITH x AS (SELECT 1) SELECT * FROM x"));
        assertTrue(SqlSyntaxValidator.isValid("SELECT 'it''s' FROM t"));
    }

    @Test
    void isValid_shouldRejectMissingSelectItem() {
        assertFalse(SqlSyntaxValidator.isValid("SELECT FROM t"));
        assertFalse(SqlSyntaxValidator.isValid("SELECT DISTINCT FROM t"));
    }

    @Test
    void isValid_shouldRejectUnbalancedParenthesesOrQuotes() {
        assertFalse(SqlSyntaxValidator.isValid("SELECT a FROM t WHERE (a > 1"));
        assertFalse(SqlSyntaxValidator.isValid("SELECT a) FROM t"));
        assertFalse(SqlSyntaxValidator.isValid("SELECT 'abc FROM t"));
    }

    @Test
    void isValid_shouldRejectNonQueries() {
        assertFalse(SqlSyntaxValidator.isValid(null));
        assertFalse(SqlSyntaxValidator.isValid("  ;"));
        assertFalse(SqlSyntaxValidator.isValid("UPDATE t SET a = 1"));
        assertFalse(SqlSyntaxValidator.isValid("selection of rows"));
    }
}
