package infra.schema;

import domain.vocabulary.SchemaVocabularySource;
import domain.vocabulary.Trie;
import domain.vocabulary.VocabularyLoader;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.openxml4j.exceptions.OpenXML4JRuntimeException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * XLSX schema description (first sheet only).
 *
 * <p>Same cell rules as {@link CsvSchemaLoader}: header row skipped when recognized,
 * every non-blank cell fed to {@link VocabularyLoader}.</p>
 */
public final class XlsxSchemaLoader implements SchemaVocabularySource {

    private final DataFormatter formatter = new DataFormatter();

    @Override
    public Trie load(Path path) {
        if (path == null) throw new IllegalArgumentException("schema path is null");
        if (!Files.isRegularFile(path)) throw new IllegalArgumentException("schema xlsx not found: " + path);

        try (InputStream is = Files.newInputStream(path);
             Workbook wb = new XSSFWorkbook(is)) {

            if (wb.getNumberOfSheets() == 0) return new Trie();
            Sheet sheet = wb.getSheetAt(0);

            List<String> cells = new ArrayList<>(256);
            boolean first = true;

            for (Row row : sheet) {
                List<String> values = new ArrayList<>();
                for (Cell cell : row) {
                    values.add(formatter.formatCellValue(cell));
                }

                // header row
                if (first) {
                    first = false;
                    if (SchemaHeaders.isHeader(values)) continue;
                }
                for (String v : values) {
                    if (v != null && !v.isBlank()) cells.add(v.trim());
                }
            }

            System.out.println("[INIT] schema xlsx cells = " + cells.size());
            return VocabularyLoader.load(cells);

        } catch (IOException | UnsupportedFileFormatException | POIXMLException | OpenXML4JRuntimeException e) {
            throw new IllegalStateException("failed to load schema xlsx: " + path, e);
        }
    }
}
