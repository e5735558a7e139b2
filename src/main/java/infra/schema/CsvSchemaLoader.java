package infra.schema;

import domain.vocabulary.SchemaVocabularySource;
import domain.vocabulary.Trie;
import domain.vocabulary.VocabularyLoader;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV schema description, e.g. an export of table/column metadata:
 * <pre>
 * tabla,columna,tipo
 * clientes,edad,int
 * </pre>
 * Every non-blank cell goes through the same word rules as the text loader, so the
 * type column ("int", "string") is dropped by the stoplist. A header row made only of
 * known header names is skipped.
 */
public final class CsvSchemaLoader implements SchemaVocabularySource {

    @Override
    public Trie load(Path path) {
        if (path == null) throw new IllegalArgumentException("schema path is null");
        if (!Files.isRegularFile(path)) throw new IllegalArgumentException("schema csv not found: " + path);

        try (InputStream is = Files.newInputStream(path);
             InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT
                     .builder()
                     .setTrim(true)
                     .setIgnoreEmptyLines(true)
                     .build()
                     .parse(reader)) {

            List<String> cells = new ArrayList<>(256);
            boolean first = true;

            for (CSVRecord r : parser) {
                List<String> row = new ArrayList<>(r.size());
                for (String v : r) row.add(v);

                if (first) {
                    first = false;
                    if (SchemaHeaders.isHeader(row)) continue;
                    if (!row.isEmpty()) row.set(0, SchemaHeaders.stripBom(row.get(0)));
                }
                for (String v : row) {
                    if (v != null && !v.isBlank()) cells.add(v);
                }
            }

            System.out.println("[INIT] schema csv cells = " + cells.size());
            return VocabularyLoader.load(cells);

        } catch (IOException e) {
            throw new IllegalStateException("failed to load schema csv: " + path, e);
        }
    }
}
