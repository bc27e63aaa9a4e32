package domain.alias;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FromJoinAliasResolverTest {

    @Test
    void resolve_shouldCollectFromAndJoinAliases() {
        AliasMap m = FromJoinAliasResolver.resolve(
                "select t1.a from hoc_sinh t1 join lop as l on t1.lop_id = l.id");

        assertEquals("hoc_sinh", m.tableFor("t1"));
        assertEquals("lop", m.tableFor("l"));
        assertEquals(List.of("hoc_sinh", "lop"), List.copyOf(m.tables()));
    }

    @Test
    void resolve_shouldFollowCommaSeparatedFromList() {
        AliasMap m = FromJoinAliasResolver.resolve("select * from emp e, dept d where e.dept_id = d.id");

        assertEquals(Map.of("e", "emp", "d", "dept"), m.asMap());
    }

    @Test
    void resolve_shouldNotTreatKeywordAsAlias() {
        AliasMap m = FromJoinAliasResolver.resolve("select a from t where a > 1");

        assertTrue(m.isEmpty());
        assertTrue(m.tables().contains("t"));
    }

    @Test
    void resolve_shouldMarkDerivedTableAliasAndScanItsBody() {
        AliasMap m = FromJoinAliasResolver.resolve("select s.n from (select name as n from emp e) s");

        assertTrue(m.isDerivedAlias("s"));
        assertNull(m.tableFor("s"));
        assertEquals("emp", m.tableFor("e"));
    }

    @Test
    void resolve_shouldKeepLastDefinition_whenAliasIsDefinedTwice() {
        AliasMap m = FromJoinAliasResolver.resolve("select t.a from a t union select t.b from b t");

        assertEquals("b", m.tableFor("t"));
    }

    @Test
    void resolve_shouldReturnEmpty_whenNoFromClause() {
        assertTrue(FromJoinAliasResolver.resolve("select 1").isEmpty());
        assertTrue(FromJoinAliasResolver.resolve(null).isEmpty());
    }
}
