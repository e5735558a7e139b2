package domain.model;

/**
 * A single warning emitted while translating one query.
 *
 * <p>Warnings are not fatal; the pipeline always produces some output. They tell the
 * operator which stage degraded and why.</p>
 */
public final class TranslationWarning {

    private final WarningCode code;
    private final String subject;
    private final String message;
    private final String detail;

    public TranslationWarning(WarningCode code, String subject, String message, String detail) {
        this.code = code == null ? WarningCode.IDENTIFIER_UNKNOWN : code;
        this.subject = nullToEmpty(subject);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static TranslationWarning of(WarningCode code, String subject, String message) {
        return new TranslationWarning(code, subject, message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    /** The file, identifier or literal the warning is about. */
    public String getSubject() {
        return subject;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return code + " [" + subject + "] " + message + (detail.isEmpty() ? "" : " (" + detail + ")");
    }
}
