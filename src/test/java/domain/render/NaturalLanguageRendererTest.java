package domain.render;

import domain.query.StructuredQuery;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NaturalLanguageRendererTest {

    private final NaturalLanguageRenderer renderer = new NaturalLanguageRenderer();

    @Test
    void should_render_spanish_pseudo_query() {
        StructuredQuery q = new StructuredQuery(null, "clientes", List.of(), List.of());

        assertEquals("selecciona * de clientes donde edad mayor 30.", renderer.render(q, "edad mayor 30"));
        assertEquals("selecciona * de clientes.", renderer.render(q, ""));
    }

    @Test
    void should_return_sentinel_without_entity() {
        assertEquals(NaturalLanguageRenderer.MISSING_ENTITY, renderer.render(StructuredQuery.empty(), "x"));
    }
}
