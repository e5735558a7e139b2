package domain.vocabulary;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Prefix-tree set of known schema identifiers (table and column names).
 *
 * <p>Words are walked by Unicode code point, so accented Spanish letters are ordinary
 * symbols. Callers insert words already lower-cased; the trie itself does no normalization.</p>
 *
 * <p>Built once by {@link VocabularyLoader}; afterwards it is only read (lookups and the
 * fuzzy-suggestion corpus).</p>
 */
public final class Trie {

    private final TrieNode root = new TrieNode();
    private int size;

    /**
     * Inserts a word. Idempotent.
     *
     * @return true if the word was not present before
     */
    public boolean insert(String word) {
        if (word == null || word.isEmpty()) return false;

        TrieNode node = root;
        for (int cp : word.codePoints().toArray()) {
            node = node.childOrCreate(cp);
        }
        if (node.isEndOfWord()) return false;

        node.markEndOfWord();
        size++;
        return true;
    }

    /** Exact match only. */
    public boolean contains(String word) {
        if (word == null) return false;
        TrieNode node = walk(word);
        return node != null && node.isEndOfWord();
    }

    /** True if any inserted word starts with {@code prefix} (the empty prefix matches a non-empty trie). */
    public boolean hasPrefix(String prefix) {
        if (prefix == null) return false;
        if (prefix.isEmpty()) return size > 0;
        return walk(prefix) != null;
    }

    /**
     * Every inserted word, duplicate-free, in code point order.
     *
     * <p>Iterative depth-first walk: stack depth is bounded by the longest word,
     * not by the vocabulary size.</p>
     */
    public List<String> enumerate() {
        List<String> words = new ArrayList<>(size);
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, ""));

        while (!stack.isEmpty()) {
            Frame f = stack.pop();
            if (f.node.isEndOfWord()) words.add(f.prefix);

            // push in reverse so the smallest code point is visited first
            List<Map.Entry<Integer, TrieNode>> entries = new ArrayList<>(f.node.children().entrySet());
            for (int i = entries.size() - 1; i >= 0; i--) {
                Map.Entry<Integer, TrieNode> e = entries.get(i);
                stack.push(new Frame(e.getValue(), f.prefix + new String(Character.toChars(e.getKey()))));
            }
        }
        return words;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    private TrieNode walk(String s) {
        TrieNode node = root;
        for (int cp : s.codePoints().toArray()) {
            node = node.child(cp);
            if (node == null) return null;
        }
        return node;
    }

    private record Frame(TrieNode node, String prefix) {}
}
