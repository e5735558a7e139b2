package infra.output;

import domain.output.SqlOutputWriter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SqlOutputWriter} that stores the final SQL into a UTF-8 text file
 * (consulta_para_gestor.txt by default). Parent directories are created.
 */
public final class FileSqlOutputWriter implements SqlOutputWriter {

    @Override
    public void write(Path outFile, String sqlText) {
        if (outFile == null) throw new IllegalArgumentException("outFile is null");

        Path parent = outFile.toAbsolutePath().getParent();
        try {
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create output directory: " + parent, e);
        }

        try {
            Files.writeString(outFile, sqlText == null ? "" : sqlText, StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write SQL file: " + outFile, e);
        }
    }
}
