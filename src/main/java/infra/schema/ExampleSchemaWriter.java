package infra.schema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Writes a small example schema (one identifier per line) when none exists yet. */
public final class ExampleSchemaWriter {

    static final List<String> EXAMPLE_WORDS = List.of(
            "clientes", "productos", "ventas",
            "nombre", "edad", "id", "dept", "precio", "fecha", "cantidad"
    );

    /** @return true if the file was created */
    public boolean writeIfMissing(Path path) {
        if (path == null) throw new IllegalArgumentException("schema path is null");
        if (Files.exists(path)) return false;

        try {
            if (path.getParent() != null) Files.createDirectories(path.getParent());
            Files.write(path, EXAMPLE_WORDS, StandardCharsets.UTF_8);
            return true;
        } catch (IOException e) {
            throw new IllegalStateException("failed to write example schema: " + path, e);
        }
    }
}
