package domain.output;

import java.nio.file.Path;

/** Persists the final SQL for the downstream query manager. */
public interface SqlOutputWriter {
    void write(Path outFile, String sqlText);
}
