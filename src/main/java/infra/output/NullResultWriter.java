package infra.output;

import domain.model.TranslationWarning;
import domain.output.ResultWriter;
import domain.pipeline.TranslationOutcome;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (feature toggle).
 */
public final class NullResultWriter implements ResultWriter {
    @Override
    public void write(Path resultXlsx, TranslationOutcome outcome, List<TranslationWarning> warnings) {
        // intentionally no-op
    }
}
