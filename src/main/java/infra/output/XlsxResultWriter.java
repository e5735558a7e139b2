package infra.output;

import domain.correct.AppliedCorrection;
import domain.model.TranslationWarning;
import domain.output.ResultWriter;
import domain.pipeline.Translation;
import domain.pipeline.TranslationOutcome;
import domain.query.StructuredQuery;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>result: one row with input, parsed fields, NL query, generated and final SQL</li>
 *   <li>corrections: one row per reviewed identifier</li>
 *   <li>warnings: non-fatal warnings (standard codes)</li>
 * </ul>
 */
public final class XlsxResultWriter implements ResultWriter {

    static final String SHEET_RESULT = "result";
    static final String SHEET_CORRECTIONS = "corrections";
    static final String SHEET_WARNINGS = "warnings";

    @Override
    public void write(Path resultXlsx, TranslationOutcome outcome, List<TranslationWarning> warnings) {
        if (resultXlsx == null) throw new IllegalArgumentException("resultXlsx is null");
        if (outcome == null) throw new IllegalArgumentException("outcome is null");

        try (Workbook wb = new XSSFWorkbook()) {
            writeResultSheet(wb, outcome);
            writeCorrectionsSheet(wb, outcome.getAppliedCorrections());
            writeWarningsSheet(wb, warnings == null ? List.of() : warnings);

            Path parent = resultXlsx.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream os = Files.newOutputStream(resultXlsx)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write result xlsx: " + resultXlsx, e);
        }
    }

    private static void writeResultSheet(Workbook wb, TranslationOutcome outcome) {
        Sheet sh = wb.createSheet(SHEET_RESULT);
        Translation t = outcome.getTranslation();
        StructuredQuery q = outcome.getFinalQuery();

        header(sh, "status", "textSource", "inputText", "action", "entity", "attributesToShow",
                "conditions", "nlQuery", "generatedSql", "finalSql", "reviewSkipped");

        Row row = sh.createRow(1);
        row.createCell(0).setCellValue(outcome.getStatus().name());
        row.createCell(1).setCellValue(outcome.getTextSource() == null ? "" : outcome.getTextSource().name());
        row.createCell(2).setCellValue(nullToEmpty(t.getInputText()));
        row.createCell(3).setCellValue(nullToEmpty(q.getAction()));
        row.createCell(4).setCellValue(nullToEmpty(q.getEntity()));
        row.createCell(5).setCellValue(String.join(", ", q.getAttributesToShow()));
        row.createCell(6).setCellValue(nullToEmpty(t.getConditionsText()));
        row.createCell(7).setCellValue(nullToEmpty(t.getNaturalLanguageQuery()));
        row.createCell(8).setCellValue(nullToEmpty(t.getSql()));
        row.createCell(9).setCellValue(nullToEmpty(outcome.getFinalSql()));
        row.createCell(10).setCellValue(outcome.isReviewSkipped());
    }

    private static void writeCorrectionsSheet(Workbook wb, List<AppliedCorrection> corrections) {
        Sheet sh = wb.createSheet(SHEET_CORRECTIONS);
        header(sh, "kind", "index", "original", "chosen", "options");

        int r = 1;
        for (AppliedCorrection ac : corrections) {
            Row row = sh.createRow(r++);
            row.createCell(0).setCellValue(ac.getRevision().getKind().label());
            row.createCell(1).setCellValue(ac.getRevision().getIndex());
            row.createCell(2).setCellValue(ac.getRevision().getOriginal());
            row.createCell(3).setCellValue(nullToEmpty(ac.getChosen()));
            row.createCell(4).setCellValue(String.join(" | ", ac.getOptions()));
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<TranslationWarning> warnings) {
        Sheet sh = wb.createSheet(SHEET_WARNINGS);
        header(sh, "code", "subject", "message", "detail");

        int r = 1;
        for (TranslationWarning w : warnings) {
            Row row = sh.createRow(r++);
            row.createCell(0).setCellValue(w.getCode().name());
            row.createCell(1).setCellValue(w.getSubject());
            row.createCell(2).setCellValue(w.getMessage());
            row.createCell(3).setCellValue(w.getDetail());
        }
    }

    private static void header(Sheet sh, String... names) {
        Row header = sh.createRow(0);
        for (int i = 0; i < names.length; i++) {
            header.createCell(i).setCellValue(names[i]);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
