package domain.model;

/**
 * Sink for translation warnings.
 *
 * <p>Warnings come from several stages (schema loading, SQL generation, correction).
 * A sink collects them without coupling those stages to the CLI or the XLSX report.</p>
 */
public interface TranslationWarningSink {

    static TranslationWarningSink none() {
        return NullTranslationWarningSink.INSTANCE;
    }

    void warn(TranslationWarning warning);
}
