package infra.text;

import domain.text.QueryTextProvider;
import domain.text.QueryTextResolution;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the transcript produced by the speech-to-text step (transcripcion.txt).
 *
 * <p>Missing, unreadable or blank transcript => {@link QueryTextProvider#EXAMPLE_QUERY}.</p>
 */
public final class FileQueryTextProvider implements QueryTextProvider {

    private final Path transcript;
    private final String exampleQuery;

    public FileQueryTextProvider(Path transcript) {
        this(transcript, EXAMPLE_QUERY);
    }

    public FileQueryTextProvider(Path transcript, String exampleQuery) {
        this.transcript = transcript;
        this.exampleQuery = exampleQuery;
    }

    @Override
    public QueryTextResolution resolve() {
        if (transcript == null || !Files.isRegularFile(transcript)) {
            return QueryTextResolution.ofExample(exampleQuery, "transcript not found: " + transcript);
        }

        try {
            String text = Files.readString(transcript, StandardCharsets.UTF_8).strip();
            if (text.isEmpty()) {
                return QueryTextResolution.ofExample(exampleQuery, "transcript is blank: " + transcript);
            }
            return QueryTextResolution.ofFile(text);
        } catch (IOException e) {
            return QueryTextResolution.ofExample(exampleQuery,
                    "transcript unreadable: " + transcript + " (" + e.getClass().getSimpleName() + ": " + e.getMessage() + ")");
        }
    }
}
