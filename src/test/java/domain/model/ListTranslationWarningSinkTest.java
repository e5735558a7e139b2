package domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListTranslationWarningSinkTest {

    @Test
    void should_deduplicate_identical_warnings() {
        List<TranslationWarning> target = new ArrayList<>();
        ListTranslationWarningSink sink = new ListTranslationWarningSink(target);

        sink.warn(TranslationWarning.of(WarningCode.DATE_REPARSE_FAILED, "31 de febrero de 2025", "kept"));
        sink.warn(TranslationWarning.of(WarningCode.DATE_REPARSE_FAILED, "31 de febrero de 2025", "kept"));
        sink.warn(TranslationWarning.of(WarningCode.DATE_REPARSE_FAILED, "30 de febrero de 2025", "kept"));
        sink.warn(null);

        assertEquals(2, target.size());
    }

    @Test
    void none_sink_should_ignore_everything() {
        assertDoesNotThrow(() -> TranslationWarningSink.none()
                .warn(TranslationWarning.of(WarningCode.ENTITY_MISSING, "", "x")));
    }
}
