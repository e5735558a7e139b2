package domain.correct;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityMatcherTest {

    private final SimilarityMatcher matcher = new SimilarityMatcher();

    @Test
    void ratio_should_follow_matching_blocks() {
        assertEquals(8.0 / 12.0, matcher.ratio("bontas", "ventas"), 1e-9);
        assertEquals(0.75, matcher.ratio("abcd", "bcde"), 1e-9);
        assertEquals(1.0, matcher.ratio("", ""), 1e-9);
        assertEquals(0.0, matcher.ratio("abc", "xyz"), 1e-9);
    }

    @Test
    void should_suggest_ventas_for_bontas() {
        List<String> out = matcher.closeMatches("bontas",
                List.of("clientes", "productos", "ventas", "nombre", "edad", "cantidad"));

        assertEquals(List.of("ventas"), out);
    }

    @Test
    void should_rank_best_first() {
        List<String> out = matcher.closeMatches("edad", List.of("edat", "edades", "dad"));
        assertEquals(List.of("dad", "edades", "edat"), out);
    }

    @Test
    void should_break_ties_in_reverse_alphabetical_order_and_honor_limit() {
        assertEquals(List.of("ad", "ac"), matcher.closeMatches("ab", List.of("ad", "ac"), 5, 0.5));
        assertEquals(List.of("ad"), matcher.closeMatches("ab", List.of("ad", "ac"), 1, 0.5));
    }

    @Test
    void should_reject_invalid_arguments() {
        assertThrows(IllegalArgumentException.class, () -> matcher.closeMatches("a", List.of("a"), 0, 0.6));
        assertThrows(IllegalArgumentException.class, () -> matcher.closeMatches("a", List.of("a"), 3, 1.5));
    }
}
