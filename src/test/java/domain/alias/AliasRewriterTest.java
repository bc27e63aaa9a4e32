package domain.alias;

import domain.model.EvaluationWarning;
import domain.model.ListEvaluationWarningSink;
import domain.model.QueryContext;
import domain.model.QuerySide;
import domain.model.WarningCode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AliasRewriterTest {

    @Test
    void rewrite_shouldReplaceAliasPrefixWithTableName() {
        String sql = "select t1.ten_hoc_sinh from hoc_sinh t1 where t1.tuoi > 18";
        String out = AliasRewriter.rewrite(sql, FromJoinAliasResolver.resolve(sql));

        assertEquals("select hoc_sinh.ten_hoc_sinh from hoc_sinh t1 where hoc_sinh.tuoi > 18", out);
    }

    @Test
    void rewrite_shouldBeNoOp_whenQueryHasNoAliases() {
        String sql = "select a, b from t where a = 1";
        assertEquals(sql, AliasRewriter.rewrite(sql, FromJoinAliasResolver.resolve(sql)));
    }

    @Test
    void rewrite_shouldOnlyTouchWholeQualifierTokens() {
        AliasMap m = AliasMap.of(Map.of("t", "tbl"));
        String out = AliasRewriter.rewrite("select st.x, t.y, t1.z from tbl t", m);

        assertEquals("select st.x, tbl.y, t1.z from tbl t", out);
    }

    @Test
    void rewrite_shouldPreserveStringLiterals() {
        AliasMap m = AliasMap.of(Map.of("t", "tbl"));
        String out = AliasRewriter.rewrite("select t.a from tbl t where t.b = 't.a'", m);

        assertEquals("select tbl.a from tbl t where tbl.b = 't.a'", out);
    }

    @Test
    void rewrite_shouldWarnAliasUnresolved_andKeepPrefix() {
        String sql = "select x.a, x.b from t";
        List<EvaluationWarning> warnings = new ArrayList<>();
        QueryContext ctx = new QueryContext(3, "db1", QuerySide.PREDICTED);

        String out = AliasRewriter.rewrite(sql, FromJoinAliasResolver.resolve(sql), Set.of(), ctx,
                new ListEvaluationWarningSink(warnings));

        assertEquals(sql, out);
        assertEquals(1, warnings.size(), "same prefix is reported once");
        EvaluationWarning w = warnings.get(0);
        assertEquals(WarningCode.ALIAS_UNRESOLVED, w.getCode());
        assertEquals(3, w.getPairIndex());
        assertEquals(QuerySide.PREDICTED, w.getSide());
        assertEquals("x", w.getDetail());
    }

    @Test
    void rewrite_shouldNotWarn_whenPrefixIsKnownSchemaTable() {
        List<EvaluationWarning> warnings = new ArrayList<>();
        String out = AliasRewriter.rewrite("select lop.ten from hoc_sinh", AliasMap.empty(),
                Set.of("lop"), QueryContext.standalone(), new ListEvaluationWarningSink(warnings));

        assertEquals("select lop.ten from hoc_sinh", out);
        assertTrue(warnings.isEmpty());
    }

    @Test
    void rewrite_shouldNotWarnForDerivedTableAlias() {
        String sql = "select s.n from (select name as n from emp) s";
        List<EvaluationWarning> warnings = new ArrayList<>();

        AliasRewriter.rewrite(sql, FromJoinAliasResolver.resolve(sql), Set.of(), QueryContext.standalone(),
                new ListEvaluationWarningSink(warnings));

        assertTrue(warnings.isEmpty());
    }
}
