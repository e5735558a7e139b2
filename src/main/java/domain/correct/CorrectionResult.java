package domain.correct;

import domain.query.StructuredQuery;

import java.util.List;

/** Final query and SQL after all revisions were resolved. */
public final class CorrectionResult {

    private final StructuredQuery query;
    private final String sql;
    private final List<Revision> revisions;
    private final List<AppliedCorrection> applied;

    public CorrectionResult(StructuredQuery query, String sql, List<Revision> revisions, List<AppliedCorrection> applied) {
        this.query = query;
        this.sql = sql;
        this.revisions = List.copyOf(revisions);
        this.applied = List.copyOf(applied);
    }

    static CorrectionResult unchanged(StructuredQuery query, String sql) {
        return new CorrectionResult(query, sql, List.of(), List.of());
    }

    public StructuredQuery getQuery() {
        return query;
    }

    public String getSql() {
        return sql;
    }

    public List<Revision> getRevisions() {
        return revisions;
    }

    public List<AppliedCorrection> getApplied() {
        return applied;
    }

    public boolean hasRevisions() {
        return !revisions.isEmpty();
    }
}
