package domain.model;
/** No-op warning sink. */
final class NullTranslationWarningSink implements TranslationWarningSink {

    static final NullTranslationWarningSink INSTANCE = new NullTranslationWarningSink();

    private NullTranslationWarningSink() {
    }

    @Override
    public void warn(TranslationWarning warning) {
        // no-op
    }
}
