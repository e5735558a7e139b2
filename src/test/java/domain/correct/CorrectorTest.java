package domain.correct;

import domain.model.ListTranslationWarningSink;
import domain.model.TranslationWarning;
import domain.model.WarningCode;
import domain.pipeline.Nl2SqlTranslator;
import domain.pipeline.Translation;
import domain.query.Condition;
import domain.query.StructuredQuery;
import domain.vocabulary.Trie;
import domain.vocabulary.VocabularyLoader;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CorrectorTest {

    private static final Trie SCHEMA = VocabularyLoader.load(
            "clientes\nproductos\nventas\nnombre\nedad\nid\ndept\nprecio\nfecha\ncantidad");

    private final Nl2SqlTranslator translator = new Nl2SqlTranslator();

    @Test
    void should_offer_ventas_for_bontas_and_update_query_and_from_clause() {
        Translation t = translator.translate("muéstrame la tabla bontas");
        assertEquals("SELECT * FROM bontas", t.getSql());

        List<List<String>> seen = new ArrayList<>();
        RevisionResolver resolver = (rev, options) -> {
            seen.add(options);
            return options.indexOf("ventas") + 1;
        };

        CorrectionResult r = new Corrector(resolver).review(t.getSql(), t.getQuery(), SCHEMA, t.getInputText());

        assertEquals(List.of(Revision.entity("bontas")), r.getRevisions());
        assertEquals("bontas", seen.get(0).get(0), "first option keeps the original");
        assertTrue(seen.get(0).contains("ventas"));
        assertEquals("ventas", r.getQuery().getEntity());
        assertEquals("SELECT * FROM ventas", r.getSql());
    }

    @Test
    void should_fix_entity_and_condition_attribute_and_record_warnings() {
        Translation t = translator.translate("muéstrame la tabla bontas donde edat es mayor a 30");
        List<TranslationWarning> warnings = new ArrayList<>();

        CorrectionResult r = new Corrector(ScriptedRevisionResolver.of(2, 2))
                .review(t.getSql(), t.getQuery(), SCHEMA, t.getInputText(), new ListTranslationWarningSink(warnings));

        assertEquals(2, r.getRevisions().size());
        assertEquals(RevisionKind.CONDITION_ATTRIBUTE, r.getRevisions().get(1).getKind());
        assertEquals(List.of("edat", "edad"), r.getApplied().get(1).getOptions());
        assertEquals("SELECT * FROM ventas WHERE edad > 30", r.getSql());
        assertEquals("edad", r.getQuery().getConditions().get(0).getAttribute());

        long unknown = warnings.stream().filter(w -> w.getCode() == WarningCode.IDENTIFIER_UNKNOWN).count();
        long corrected = warnings.stream().filter(w -> w.getCode() == WarningCode.IDENTIFIER_CORRECTED).count();
        assertEquals(2, unknown);
        assertEquals(2, corrected);
    }

    @Test
    void should_replace_shown_attribute_in_select_list() {
        Trie vocabulary = VocabularyLoader.load("clientes nombres");
        StructuredQuery q = new StructuredQuery(null, "clientes", List.of("nombre"), List.of());

        CorrectionResult r = new Corrector(new AutoSuggestRevisionResolver())
                .review("SELECT nombre FROM clientes", q, vocabulary, "");

        assertEquals(List.of("nombres"), r.getQuery().getAttributesToShow());
        assertEquals("SELECT nombres FROM clientes", r.getSql());
        assertTrue(r.getApplied().get(0).isChanged());
    }

    @Test
    void should_keep_original_when_first_option_is_chosen() {
        StructuredQuery q = new StructuredQuery(null, "bontas", List.of(), List.of());
        List<TranslationWarning> warnings = new ArrayList<>();

        CorrectionResult r = new Corrector(ScriptedRevisionResolver.of(1))
                .review("SELECT * FROM bontas", q, SCHEMA, "", new ListTranslationWarningSink(warnings));

        assertEquals("SELECT * FROM bontas", r.getSql());
        assertFalse(r.getApplied().get(0).isChanged());
        assertTrue(warnings.stream().noneMatch(w -> w.getCode() == WarningCode.IDENTIFIER_CORRECTED));
    }

    @Test
    void should_return_unchanged_result_when_everything_is_known() {
        StructuredQuery q = new StructuredQuery(null, "clientes", List.of("nombre"), List.of(Condition.eq("id", "7")));

        CorrectionResult r = new Corrector(ScriptedRevisionResolver.of())
                .review("SELECT nombre FROM clientes WHERE id = 7", q, SCHEMA, "");

        assertFalse(r.hasRevisions());
        assertSame(q, r.getQuery());
        assertEquals("SELECT nombre FROM clientes WHERE id = 7", r.getSql());
        assertTrue(r.getApplied().isEmpty());
    }

    @Test
    void should_reject_choice_out_of_range() {
        StructuredQuery q = new StructuredQuery(null, "bontas", List.of(), List.of());
        Corrector corrector = new Corrector((rev, options) -> 9);

        assertThrows(IllegalArgumentException.class,
                () -> corrector.review("SELECT * FROM bontas", q, SCHEMA, ""));
    }

    @Test
    void findRevisions_should_list_entity_then_shown_then_condition_attributes() {
        StructuredQuery q = new StructuredQuery(null, "bontas", List.of("nombre", "apellido"),
                List.of(Condition.eq("edat", "30"), Condition.eq("id", "1")));

        List<Revision> revs = Corrector.findRevisions(q, SCHEMA);

        assertEquals(List.of(
                Revision.entity("bontas"),
                new Revision(RevisionKind.SHOWN_ATTRIBUTE, "apellido", 1),
                new Revision(RevisionKind.CONDITION_ATTRIBUTE, "edat", 0)
        ), revs);
    }

    @Test
    void replaceFirstWord_should_respect_word_boundaries() {
        assertEquals("SELECT edad, edades FROM t",
                Corrector.replaceFirstWord("SELECT edat, edades FROM t", "edat", "edad"));
        assertEquals("SELECT nombres FROM nombre_t",
                Corrector.replaceFirstWord("SELECT nombre FROM nombre_t", "nombre", "nombres"));
    }
}
