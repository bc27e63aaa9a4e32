package domain.eval;

import domain.alias.AliasMap;
import domain.alias.AliasRewriter;
import domain.alias.FromJoinAliasResolver;
import domain.clause.ClauseExtractor;
import domain.clause.ComponentExtractor;
import domain.clause.ComponentSet;
import domain.clause.ExtractedClauses;
import domain.model.EvaluationWarning;
import domain.model.EvaluationWarningSink;
import domain.model.QueryContext;
import domain.model.WarningCode;
import domain.normalize.SqlTextNormalizer;
import domain.schema.SchemaBinder;
import domain.schema.SchemaCatalog;
import domain.sql.SqlSyntaxValidator;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Runs one query through normalize, alias resolution, clause extraction and schema binding.
 * Stateless; the alias map lives only for the duration of one call.
 */
public final class QueryAnalyzer {

    private final SchemaCatalog catalog;

    public QueryAnalyzer(SchemaCatalog catalog) {
        this.catalog = catalog == null ? SchemaCatalog.empty() : catalog;
    }

    public AnalyzedQuery analyze(String sql, QueryContext ctx, EvaluationWarningSink sink) {
        String raw = sql == null ? "" : sql;
        EvaluationWarningSink warnSink = sink == null ? EvaluationWarningSink.none() : sink;
        QueryContext c = ctx == null ? QueryContext.standalone() : ctx;

        SchemaBinder binder = binderFor(c, warnSink);

        String query = SqlTextNormalizer.normalizeQuery(raw);
        AliasMap aliases = FromJoinAliasResolver.resolve(query);
        String resolved = AliasRewriter.rewrite(query, aliases,
                binder == null ? Set.of() : binder.tableKeys(), c, warnSink);

        ExtractedClauses clauses = ClauseExtractor.extract(resolved);
        if (clauses.isDegraded()) {
            warnSink.warn(EvaluationWarning.of(WarningCode.PARSE_DEGRADED, c,
                    "no top-level SELECT found; every clause treated as absent", abbreviate(query)));
        }

        Set<String> scope = new LinkedHashSet<>();
        for (String t : aliases.tables()) scope.add(SqlTextNormalizer.identifierKey(t));

        ComponentSet components = ComponentExtractor.extract(clauses, query, binder, scope, c, warnSink);

        return new AnalyzedQuery(raw, SqlTextNormalizer.normalize(raw), resolved, aliases,
                clauses, components, SqlSyntaxValidator.isValid(raw));
    }

    private SchemaBinder binderFor(QueryContext c, EvaluationWarningSink sink) {
        String dbId = c.getDbId();
        if (dbId == null || dbId.isEmpty() || catalog.size() == 0) return null;

        SchemaBinder binder = catalog.binderFor(dbId);
        if (binder == null) {
            sink.warn(EvaluationWarning.of(WarningCode.UNKNOWN_DB_ID, c,
                    "db_id not in schema catalog; columns left unbound", dbId));
        }
        return binder;
    }

    private static String abbreviate(String s) {
        return s.length() <= 120 ? s : s.substring(0, 117) + "...";
    }
}
