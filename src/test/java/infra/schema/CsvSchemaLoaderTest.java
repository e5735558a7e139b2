package infra.schema;

import domain.vocabulary.Trie;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvSchemaLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void should_skip_header_and_drop_type_column() throws Exception {
        Path f = tempDir.resolve("schema.csv");
        Files.writeString(f, String.join("\n",
                "tabla,columna,tipo",
                "clientes,edad,int",
                "clientes,nombre,string",
                "",
                "ventas,fecha,date"
        ), StandardCharsets.UTF_8);

        Trie trie = new CsvSchemaLoader().load(f);

        assertEquals(List.of("clientes", "edad", "fecha", "nombre", "ventas"), trie.enumerate());
        assertFalse(trie.contains("tabla"));
    }

    @Test
    void should_keep_first_row_when_it_is_data() throws Exception {
        Path f = tempDir.resolve("schema.csv");
        Files.writeString(f, "productos,precio\nproductos,id\n", StandardCharsets.UTF_8);

        Trie trie = new CsvSchemaLoader().load(f);

        assertEquals(List.of("id", "precio", "productos"), trie.enumerate());
    }

    @Test
    void should_reject_missing_file() {
        assertThrows(IllegalArgumentException.class,
                () -> new CsvSchemaLoader().load(tempDir.resolve("missing.csv")));
    }
}
