package infra.schema;

import domain.vocabulary.SchemaVocabularySource;
import domain.vocabulary.Trie;
import domain.vocabulary.VocabularyLoader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Plain text schema description (relaciones_tablas.txt).
 *
 * <p>Usually one identifier per line, but free text is accepted: "ventas # id fecha int"
 * yields ventas, id, fecha.</p>
 */
public final class TextSchemaLoader implements SchemaVocabularySource {

    @Override
    public Trie load(Path path) {
        if (path == null) throw new IllegalArgumentException("schema path is null");
        if (!Files.isRegularFile(path)) throw new IllegalArgumentException("schema file not found: " + path);

        try {
            List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            if (!lines.isEmpty()) lines.set(0, SchemaHeaders.stripBom(lines.get(0)));
            return VocabularyLoader.load(lines);
        } catch (IOException e) {
            throw new IllegalStateException("failed to read schema file: " + path, e);
        }
    }
}
