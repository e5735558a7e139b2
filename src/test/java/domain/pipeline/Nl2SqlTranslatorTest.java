package domain.pipeline;

import domain.model.ListTranslationWarningSink;
import domain.model.TranslationWarning;
import domain.model.WarningCode;
import domain.query.ComparisonOperator;
import domain.query.Condition;
import domain.render.NaturalLanguageRenderer;
import domain.render.SqlGenerator;
import domain.text.QueryTextProvider;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Nl2SqlTranslatorTest {

    private final Nl2SqlTranslator translator = new Nl2SqlTranslator();

    @Test
    void should_translate_end_to_end() {
        Translation t = translator.translate("muéstrame los clientes donde la edad es mayor a 30");

        assertEquals("clientes", t.getQuery().getEntity());
        assertEquals(List.of(new Condition("edad", ComparisonOperator.GT, "30")), t.getQuery().getConditions());
        assertEquals("edad mayor 30", t.getConditionsText());
        assertEquals("selecciona * de clientes donde edad mayor 30.", t.getNaturalLanguageQuery());
        assertEquals("SELECT * FROM clientes WHERE edad > 30", t.getSql());
        assertEquals(10, t.getTokens().size());
    }

    @Test
    void should_produce_sentinels_when_no_table_is_recognized() {
        List<TranslationWarning> warnings = new ArrayList<>();
        Translation t = translator.translate(QueryTextProvider.EXAMPLE_QUERY, new ListTranslationWarningSink(warnings));

        assertFalse(t.getQuery().hasEntity());
        assertEquals("muéstrame", t.getQuery().getAction());
        assertEquals(SqlGenerator.MISSING_ENTITY, t.getSql());
        assertEquals(NaturalLanguageRenderer.MISSING_ENTITY, t.getNaturalLanguageQuery());
        assertEquals(WarningCode.ENTITY_MISSING, warnings.get(0).getCode());
    }

    @Test
    void should_treat_null_text_as_empty() {
        Translation t = translator.translate(null);

        assertEquals("", t.getInputText());
        assertTrue(t.getTokens().isEmpty());
        assertEquals(SqlGenerator.MISSING_ENTITY, t.getSql());
    }
}
