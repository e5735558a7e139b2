package domain.output;

import domain.model.TranslationWarning;
import domain.pipeline.TranslationOutcome;

import java.nio.file.Path;
import java.util.List;

/** Stores the translation report. */
public interface ResultWriter {

    void write(Path resultXlsx, TranslationOutcome outcome, List<TranslationWarning> warnings);
}
