package domain.parse;

import java.util.List;

/**
 * Result of a successful {@link ParseRule}: the edits to apply and how many tokens
 * the cursor moves forward (always at least 1).
 */
public final class RuleMatch {

    private final List<QueryEdit> edits;
    private final int consumed;

    public RuleMatch(List<QueryEdit> edits, int consumed) {
        if (consumed < 1) throw new IllegalArgumentException("consumed must be >= 1: " + consumed);
        this.edits = edits == null ? List.of() : List.copyOf(edits);
        this.consumed = consumed;
    }

    public static RuleMatch of(int consumed, QueryEdit... edits) {
        return new RuleMatch(List.of(edits), consumed);
    }

    public List<QueryEdit> getEdits() {
        return edits;
    }

    public int getConsumed() {
        return consumed;
    }

    @Override
    public String toString() {
        return "RuleMatch{edits=" + edits + ", consumed=" + consumed + '}';
    }
}
