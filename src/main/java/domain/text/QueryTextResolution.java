package domain.text;

/**
 * Result of {@link QueryTextProvider}: the text plus whether the example fallback was used.
 */
public final class QueryTextResolution {

    private final String text;
    private final QueryTextSource source;
    /**
     * Why the fallback was needed (missing file, blank transcript...). null when not used.
     */
    private final String fallbackReason;

    private QueryTextResolution(String text, QueryTextSource source, String fallbackReason) {
        this.text = text == null ? "" : text;
        this.source = source;
        this.fallbackReason = fallbackReason;
    }

    public static QueryTextResolution ofArgument(String text) {
        return new QueryTextResolution(text, QueryTextSource.ARGUMENT, null);
    }

    public static QueryTextResolution ofFile(String text) {
        return new QueryTextResolution(text, QueryTextSource.FILE, null);
    }

    public static QueryTextResolution ofExample(String text, String reason) {
        return new QueryTextResolution(text, QueryTextSource.EXAMPLE, reason);
    }

    public String getText() {
        return text;
    }

    public QueryTextSource getSource() {
        return source;
    }

    public boolean isFallbackUsed() {
        return source == QueryTextSource.EXAMPLE;
    }

    public String getFallbackReason() {
        return fallbackReason;
    }
}
