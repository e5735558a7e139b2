package domain.pipeline;

import domain.correct.AppliedCorrection;
import domain.correct.CorrectionResult;
import domain.query.StructuredQuery;
import domain.text.QueryTextSource;

import java.util.List;

/**
 * Everything one CLI run produced: the translation, the review (if any) and the final SQL.
 */
public final class TranslationOutcome {

    public enum Status {
        /** SQL generated, all identifiers known (or review skipped). */
        OK,
        /** SQL generated, at least one identifier went through review. */
        REVIEWED,
        /** No table recognized; the SQL text is the sentinel comment. */
        NO_ENTITY
    }

    private final QueryTextSource textSource;
    private final Translation translation;
    private final CorrectionResult correction;
    private final boolean reviewSkipped;

    public TranslationOutcome(QueryTextSource textSource, Translation translation,
                              CorrectionResult correction, boolean reviewSkipped) {
        this.textSource = textSource;
        this.translation = translation;
        this.correction = correction;
        this.reviewSkipped = reviewSkipped;
    }

    public QueryTextSource getTextSource() {
        return textSource;
    }

    public Translation getTranslation() {
        return translation;
    }

    /** null when the review was skipped (no vocabulary, or disabled). */
    public CorrectionResult getCorrection() {
        return correction;
    }

    public boolean isReviewSkipped() {
        return reviewSkipped;
    }

    public StructuredQuery getFinalQuery() {
        return correction == null ? translation.getQuery() : correction.getQuery();
    }

    public String getFinalSql() {
        return correction == null ? translation.getSql() : correction.getSql();
    }

    public List<AppliedCorrection> getAppliedCorrections() {
        return correction == null ? List.of() : correction.getApplied();
    }

    public Status getStatus() {
        if (!translation.getQuery().hasEntity()) return Status.NO_ENTITY;
        if (correction != null && correction.hasRevisions()) return Status.REVIEWED;
        return Status.OK;
    }
}
