package domain.vocabulary;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrieTest {

    @Test
    void should_contain_every_inserted_word_after_later_inserts() {
        Trie trie = new Trie();
        assertTrue(trie.insert("ventas"));
        assertTrue(trie.contains("ventas"));

        trie.insert("venta");
        trie.insert("vendedor");
        trie.insert("clientes");

        assertTrue(trie.contains("ventas"));
        assertTrue(trie.contains("venta"));
        assertFalse(trie.contains("vent"), "prefix alone is not a word");
        assertFalse(trie.contains("ventass"));
        assertEquals(4, trie.size());
    }

    @Test
    void should_be_idempotent_on_duplicate_insert() {
        Trie trie = new Trie();
        assertTrue(trie.insert("edad"));
        assertFalse(trie.insert("edad"));
        assertFalse(trie.insert(""));
        assertFalse(trie.insert(null));
        assertEquals(1, trie.size());
    }

    @Test
    void should_enumerate_same_set_regardless_of_insertion_order() {
        Trie a = new Trie();
        for (String w : List.of("precio", "productos", "id", "fecha", "edad")) a.insert(w);

        Trie b = new Trie();
        for (String w : List.of("edad", "id", "fecha", "productos", "precio", "id")) b.insert(w);

        List<String> expected = List.of("edad", "fecha", "id", "precio", "productos");
        assertEquals(expected, a.enumerate());
        assertEquals(expected, b.enumerate());
    }

    @Test
    void should_handle_accented_letters_and_prefix_queries() {
        Trie trie = new Trie();
        trie.insert("número");
        trie.insert("año");

        assertTrue(trie.contains("número"));
        assertTrue(trie.hasPrefix("núm"));
        assertTrue(trie.hasPrefix("a"));
        assertFalse(trie.hasPrefix("x"));
        assertTrue(trie.hasPrefix(""));
    }

    @Test
    void should_report_empty_trie() {
        Trie trie = new Trie();
        assertTrue(trie.isEmpty());
        assertFalse(trie.hasPrefix(""));
        assertTrue(trie.enumerate().isEmpty());
    }

    @Test
    void should_enumerate_very_long_word_without_recursion() {
        String longWord = "a".repeat(5000);
        Trie trie = new Trie();
        trie.insert(longWord);
        trie.insert("b");

        List<String> words = trie.enumerate();
        assertEquals(2, words.size());
        assertEquals(longWord, words.get(0));
    }
}
