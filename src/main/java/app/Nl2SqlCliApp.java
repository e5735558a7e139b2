package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.Nl2SqlCli;
import domain.correct.CorrectionResult;
import domain.correct.Corrector;
import domain.correct.RevisionResolver;
import domain.model.ListTranslationWarningSink;
import domain.model.TranslationWarning;
import domain.model.TranslationWarningSink;
import domain.model.WarningCode;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import domain.pipeline.Nl2SqlTranslator;
import domain.pipeline.Translation;
import domain.pipeline.TranslationOutcome;
import domain.text.QueryTextProvider;
import domain.text.QueryTextResolution;
import domain.vocabulary.SchemaVocabularySource;
import domain.vocabulary.Trie;
import infra.schema.ExampleSchemaWriter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** CLI entry (invoked by {@link Nl2SqlCli}). */
public final class Nl2SqlCliApp {

    static final String DEFAULT_SCHEMA = "relaciones_tablas.txt";
    static final String DEFAULT_INPUT = "transcripcion.txt";
    static final String DEFAULT_OUT = "consulta_para_gestor.txt";
    static final String DEFAULT_RESULT = "output/nl2sql-result.xlsx";

    private Nl2SqlCliApp() {}

    public static void main(String[] args) {
        run(args);
    }

    /** Runs one translation and returns its outcome (used by tests with non-interactive options). */
    static TranslationOutcome run(String[] args) {

        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        // ------------------------------------------------------------
        // baseDir + input / output paths
        // ------------------------------------------------------------
        CliPathResolver.applyBaseDirPropertyIfPresent(argv);
        Path baseDir = CliPathResolver.resolveBaseDir();

        Path schemaPath = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("schema", DEFAULT_SCHEMA));
        Path inputPath  = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("input", DEFAULT_INPUT));
        Path outPath    = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("out", DEFAULT_OUT));
        Path resultXlsx = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("result", DEFAULT_RESULT));

        String queryArg = argv.containsKey("query") ? argv.get("query") : null;

        // ------------------------------------------------------------
        // feature toggles (presence-style)
        // ------------------------------------------------------------
        boolean noSqlOut    = CliArgParser.flag(argv, "noSqlOut");
        boolean noResult    = CliArgParser.flag(argv, "noResult");
        boolean noReview    = CliArgParser.flag(argv, "noReview");
        boolean initSchema  = CliArgParser.flag(argv, "initSchema");
        boolean autoSuggest = CliArgParser.flag(argv, "autoSuggest");
        List<Integer> choices = argv.containsKey("choices") ? CliArgParser.parseChoices(argv.get("choices")) : null;

        System.out.println("==================================================");
        System.out.println("[START] NL -> SQL translation");
        System.out.println("[CONF] baseDir        = " + baseDir.toAbsolutePath());
        System.out.println("[CONF] schema         = " + schemaPath);
        System.out.println("[CONF] input          = " + (queryArg != null ? "(--query)" : inputPath.toString()));
        System.out.println("[CONF] out            = " + outPath);
        System.out.println("[CONF] result         = " + resultXlsx);
        System.out.println("[CONF] initSchema     = " + initSchema);
        System.out.println("[CONF] choices        = " + (choices == null ? "(interactive)" : choices.toString()));
        System.out.println("[CONF] autoSuggest    = " + autoSuggest);
        System.out.println("[CONF] enableReview   = " + (!noReview) + " (use --noReview)");
        System.out.println("[CONF] enableSqlOut   = " + (!noSqlOut) + " (use --noSqlOut)");
        System.out.println("[CONF] enableResult   = " + (!noResult) + " (use --noResult)");
        System.out.println("==================================================");

        // warnings (collected even when result xlsx is disabled)
        List<TranslationWarning> warnings = new ArrayList<>(16);
        TranslationWarningSink warningSink = new ListTranslationWarningSink(warnings);

        Nl2SqlComponentsFactory factory = new Nl2SqlComponentsFactory();

        // ------------------------------------------------------------
        // STEP1: schema vocabulary
        // ------------------------------------------------------------
        long tSchema0 = System.nanoTime();
        if (initSchema) {
            boolean created = new ExampleSchemaWriter().writeIfMissing(schemaPath);
            System.out.println("[STEP1] example schema " + (created ? "written: " : "kept (already exists): ") + schemaPath);
        }
        Trie vocabulary = loadVocabulary(factory.createSchemaSource(schemaPath), schemaPath, warningSink);
        if (vocabulary != null) {
            System.out.println("[STEP1] schema vocabulary loaded. size=" + vocabulary.size() + ", elapsed=" + ms(tSchema0) + "ms");
            printVocabulary(vocabulary);
        } else {
            System.out.println("[STEP1] schema vocabulary unavailable; review will be skipped. elapsed=" + ms(tSchema0) + "ms");
        }

        // ------------------------------------------------------------
        // STEP2: query text
        // ------------------------------------------------------------
        QueryTextProvider textProvider = factory.createQueryTextProvider(queryArg, inputPath);
        QueryTextResolution text = textProvider.resolve();
        if (text.isFallbackUsed()) {
            System.out.println("[WARN] " + text.getFallbackReason() + " => using example query.");
            warningSink.warn(new TranslationWarning(WarningCode.QUERY_TEXT_MISSING,
                    queryArg != null ? "--query" : String.valueOf(inputPath),
                    "example query used", safe(text.getFallbackReason())));
        }
        System.out.println("[STEP2] query text (" + text.getSource() + ") = '" + text.getText() + "'");

        // ------------------------------------------------------------
        // STEP3: translate
        // ------------------------------------------------------------
        long tTr0 = System.nanoTime();
        Nl2SqlTranslator translator = factory.createTranslator();
        Translation translation = translator.translate(text.getText(), warningSink);
        System.out.println("[STEP3] translated. elapsed=" + ms(tTr0) + "ms");

        // ------------------------------------------------------------
        // STEP4: review unknown identifiers
        // ------------------------------------------------------------
        CorrectionResult correction = null;
        boolean reviewSkipped = true;
        if (noReview) {
            System.out.println("[STEP4] review skipped (--noReview).");
        } else if (vocabulary == null) {
            System.out.println("[STEP4] review skipped (no schema vocabulary).");
        } else {
            RevisionResolver resolver = factory.createRevisionResolver(choices, autoSuggest);
            Corrector corrector = factory.createCorrector(resolver, translator);
            correction = corrector.review(translation.getSql(), translation.getQuery(), vocabulary,
                    translation.getInputText(), warningSink);
            reviewSkipped = false;
            System.out.println("[STEP4] review done. revisions=" + correction.getRevisions().size());
        }

        TranslationOutcome outcome = new TranslationOutcome(text.getSource(), translation, correction, reviewSkipped);
        System.out.println("[FINAL] " + outcome.getFinalSql());

        // ------------------------------------------------------------
        // STEP5: final SQL file
        // ------------------------------------------------------------
        SqlOutputWriter sqlOutputWriter = factory.createSqlOutputWriter(!noSqlOut);
        if (!noSqlOut) {
            sqlOutputWriter.write(outPath, outcome.getFinalSql());
            System.out.println("[STEP5] final SQL written: " + outPath);
        } else {
            System.out.println("[STEP5] final SQL file skipped (--noSqlOut).");
        }

        System.out.println("[STAT] status=" + outcome.getStatus() + ", corrections=" + outcome.getAppliedCorrections().size());
        System.out.println("[STAT] warnings=" + warnings.size());

        // ------------------------------------------------------------
        // STEP6: xlsx report
        // ------------------------------------------------------------
        ResultWriter resultWriter = factory.createResultWriter(!noResult);
        if (!noResult) {
            long tXlsx0 = System.nanoTime();
            resultWriter.write(resultXlsx, outcome, warnings);
            System.out.println("[STEP6] result xlsx written. elapsed=" + ms(tXlsx0) + "ms");
        } else {
            System.out.println("[STEP6] result xlsx skipped (--noResult).");
        }

        System.out.println("==================================================");
        System.out.println("[DONE] totalElapsed=" + ms(t0) + "ms");
        System.out.println("==================================================");
        return outcome;
    }

    /** null means "no vocabulary available": the review is skipped, the run goes on. */
    static Trie loadVocabulary(SchemaVocabularySource source, Path schemaPath, TranslationWarningSink warningSink) {
        if (schemaPath == null || !Files.isRegularFile(schemaPath)) {
            System.out.println("[WARN] schema file not found: " + schemaPath);
            System.out.println("       - use --initSchema to write the example schema, or --schema=<file>.");
            warningSink.warn(TranslationWarning.of(WarningCode.SCHEMA_SOURCE_MISSING,
                    String.valueOf(schemaPath), "schema file not found"));
            return null;
        }
        try {
            return source.load(schemaPath);
        } catch (IllegalArgumentException | IllegalStateException e) {
            System.out.println("[WARN] schema file unreadable: " + schemaPath);
            System.out.println("       ex=" + e.getClass().getName() + ": " + safe(e.getMessage()));
            warningSink.warn(new TranslationWarning(WarningCode.SCHEMA_SOURCE_UNREADABLE,
                    String.valueOf(schemaPath), e.getClass().getSimpleName(), safe(e.getMessage())));
            return null;
        }
    }

    static void printVocabulary(Trie vocabulary) {
        if (vocabulary.isEmpty()) {
            System.out.println("El Trie está vacío.");
            return;
        }
        System.out.println("[INIT] vocabulary = " + String.join(", ", vocabulary.enumerate()));
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return (s == null) ? "" : s;
    }
}
