package app;

import cli.CliPathResolver;
import domain.model.ListTranslationWarningSink;
import domain.model.TranslationWarning;
import domain.model.WarningCode;
import domain.pipeline.TranslationOutcome;
import domain.text.QueryTextSource;
import domain.vocabulary.Trie;
import infra.schema.TextSchemaLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Nl2SqlCliAppTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearBaseDir() {
        System.clearProperty(CliPathResolver.PROP_BASE_DIR);
    }

    @Test
    void should_translate_review_and_write_outputs() throws Exception {
        TranslationOutcome outcome = Nl2SqlCliApp.run(new String[]{
                "--baseDir", tempDir.toString(),
                "--initSchema",
                "--query", "muéstrame la tabla bontas donde edat es mayor a 30",
                "--choices=2,2"
        });

        assertEquals(TranslationOutcome.Status.REVIEWED, outcome.getStatus());
        assertEquals(QueryTextSource.ARGUMENT, outcome.getTextSource());
        assertEquals("SELECT * FROM ventas WHERE edad > 30", outcome.getFinalSql());

        Path sqlFile = tempDir.resolve(Nl2SqlCliApp.DEFAULT_OUT);
        assertEquals("SELECT * FROM ventas WHERE edad > 30", Files.readString(sqlFile, StandardCharsets.UTF_8));
        assertTrue(Files.exists(tempDir.resolve(Nl2SqlCliApp.DEFAULT_SCHEMA)));
        assertTrue(Files.exists(tempDir.resolve(Nl2SqlCliApp.DEFAULT_RESULT)));
    }

    @Test
    void should_read_transcript_and_skip_review_without_schema() throws Exception {
        Files.writeString(tempDir.resolve(Nl2SqlCliApp.DEFAULT_INPUT),
                "muéstrame los clientes donde la edad es mayor a 30", StandardCharsets.UTF_8);

        TranslationOutcome outcome = Nl2SqlCliApp.run(new String[]{
                "--baseDir=" + tempDir, "--noResult", "--noSqlOut"
        });

        assertTrue(outcome.isReviewSkipped());
        assertNull(outcome.getCorrection());
        assertEquals(QueryTextSource.FILE, outcome.getTextSource());
        assertEquals("SELECT * FROM clientes WHERE edad > 30", outcome.getFinalSql());
        assertFalse(Files.exists(tempDir.resolve(Nl2SqlCliApp.DEFAULT_OUT)));
    }

    @Test
    void should_fall_back_to_example_query_and_write_sentinel() throws Exception {
        TranslationOutcome outcome = Nl2SqlCliApp.run(new String[]{
                "--baseDir=" + tempDir, "--initSchema", "--noResult", "--autoSuggest"
        });

        assertEquals(QueryTextSource.EXAMPLE, outcome.getTextSource());
        assertEquals(TranslationOutcome.Status.NO_ENTITY, outcome.getStatus());
        assertFalse(outcome.isReviewSkipped());
        assertNotNull(outcome.getCorrection());
        assertEquals("edad", outcome.getFinalQuery().getConditions().get(0).getAttribute());
        assertEquals("-- No se puede generar consulta SQL: entidad desconocida.",
                Files.readString(tempDir.resolve(Nl2SqlCliApp.DEFAULT_OUT), StandardCharsets.UTF_8));
    }

    @Test
    void should_keep_original_when_scripted_choices_are_out_of_range_or_malformed() throws Exception {
        TranslationOutcome outOfRange = Nl2SqlCliApp.run(new String[]{
                "--baseDir=" + tempDir, "--initSchema", "--noResult", "--noSqlOut",
                "--query", "muéstrame la tabla bontas", "--choices=9"
        });
        assertEquals("SELECT * FROM bontas", outOfRange.getFinalSql());
        assertFalse(outOfRange.isReviewSkipped());

        TranslationOutcome malformed = Nl2SqlCliApp.run(new String[]{
                "--baseDir=" + tempDir, "--noResult", "--noSqlOut",
                "--query", "muéstrame la tabla bontas", "--choices=abc"
        });
        assertEquals("SELECT * FROM bontas", malformed.getFinalSql());
        assertEquals(1, malformed.getAppliedCorrections().size());
    }

    @Test
    void loadVocabulary_should_degrade_and_warn_on_missing_file() {
        List<TranslationWarning> warnings = new ArrayList<>();

        Trie trie = Nl2SqlCliApp.loadVocabulary(new TextSchemaLoader(), tempDir.resolve("nope.txt"),
                new ListTranslationWarningSink(warnings));

        assertNull(trie);
        assertEquals(WarningCode.SCHEMA_SOURCE_MISSING, warnings.get(0).getCode());
    }
}
