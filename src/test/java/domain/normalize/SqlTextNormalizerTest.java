package domain.normalize;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlTextNormalizerTest {

    @Test
    void normalize_shouldLowerCaseCollapseWhitespaceAndDropTrailingSemicolon() {
        String n = SqlTextNormalizer.normalize("SELECT  Name\n\tFROM   Emp ;");
        assertEquals("select name from emp", n);
    }

    @Test
    void normalize_shouldTightenAggregateCallSpacing() {
        assertEquals("select count(*) from t", SqlTextNormalizer.normalize("SELECT COUNT ( * ) FROM t"));
        assertEquals("select max(age) from t", SqlTextNormalizer.normalize("select MAX(  age ) from t"));
        assertEquals("select sum(avg(x)) from t", SqlTextNormalizer.normalize("select sum( avg ( x ) ) from t"));
    }

    @Test
    void normalize_shouldFoldUnderscoresButNormalizeQueryShouldKeepThem() {
        assertEquals("ten hoc sinh", SqlTextNormalizer.normalize("TEN_HOC_SINH"));
        assertEquals("ten_hoc_sinh", SqlTextNormalizer.normalizeQuery("TEN_HOC_SINH"));
        assertEquals(SqlTextNormalizer.identifierKey("ten_hoc_sinh"), SqlTextNormalizer.identifierKey("ten hoc sinh"));
    }

    @Test
    void normalize_shouldComposeUnicodeToNfc() {
        String composed = "Caf\u00e9";
        String decomposed = "Cafe\u0301";
        assertEquals(SqlTextNormalizer.normalize(composed), SqlTextNormalizer.normalize(decomposed));
        assertEquals("caf\u00e9", SqlTextNormalizer.normalize(decomposed));
    }

    @Test
    void normalize_shouldBeIdempotent() {
        String[] inputs = {
                "SELECT COUNT ( DISTINCT hoc_sinh.ten ) FROM hoc_sinh ;;",
                "  select   a ,b  from t where x = 'A  B' ",
                "SELECT Tuổi FROM Lớp"
        };
        for (String in : inputs) {
            String once = SqlTextNormalizer.normalize(in);
            assertEquals(once, SqlTextNormalizer.normalize(once), in);
            String q = SqlTextNormalizer.normalizeQuery(in);
            assertEquals(q, SqlTextNormalizer.normalizeQuery(q), in);
        }
    }

    @Test
    void normalize_shouldReturnEmpty_whenNullOrEmpty() {
        assertEquals("", SqlTextNormalizer.normalize(null));
        assertEquals("", SqlTextNormalizer.normalize(""));
        assertEquals("", SqlTextNormalizer.normalizeQuery("  ; "));
    }
}
