package domain.model;

/**
 * Standard warning codes of the translation pipeline.
 *
 * <p>Keep the set small and stable.</p>
 */
public enum WarningCode {

    /**
     * Schema vocabulary file does not exist; correction is skipped.
     */
    SCHEMA_SOURCE_MISSING,

    /**
     * Schema vocabulary file exists but could not be read or parsed; correction is skipped.
     */
    SCHEMA_SOURCE_UNREADABLE,

    /**
     * Transcript / query file is missing or blank; the fixed example query is used.
     */
    QUERY_TEXT_MISSING,

    /**
     * No table was recognized, so no SQL could be generated.
     */
    ENTITY_MISSING,

    /**
     * A spelled-out date could not be converted to ISO; the spoken text is kept.
     */
    DATE_REPARSE_FAILED,

    /**
     * A table or column is not in the schema vocabulary.
     */
    IDENTIFIER_UNKNOWN,

    /**
     * An unknown identifier was replaced by a vocabulary word.
     */
    IDENTIFIER_CORRECTED
}
