package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>Deduplicates by (code|subject|message|detail): SQL is regenerated after every
 * condition correction and would otherwise repeat the same date warning.</p>
 */
public final class ListTranslationWarningSink implements TranslationWarningSink {

    private final List<TranslationWarning> target;
    private final Set<String> seen = new HashSet<>(64);

    public ListTranslationWarningSink(List<TranslationWarning> target) {
        this.target = target;
    }

    private static String key(TranslationWarning w) {
        return w.getCode().name() + "|"
                + w.getSubject() + "|"
                + w.getMessage() + "|"
                + w.getDetail();
    }

    @Override
    public void warn(TranslationWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
        }
    }
}
