package domain.vocabulary;

import java.util.Map;
import java.util.TreeMap;

/** One node of {@link Trie}. Children are keyed by code point and created on demand. */
final class TrieNode {

    private final Map<Integer, TrieNode> children = new TreeMap<>();
    private boolean endOfWord;

    TrieNode child(int codePoint) {
        return children.get(codePoint);
    }

    TrieNode childOrCreate(int codePoint) {
        return children.computeIfAbsent(codePoint, k -> new TrieNode());
    }

    Map<Integer, TrieNode> children() {
        return children;
    }

    boolean isEndOfWord() {
        return endOfWord;
    }

    void markEndOfWord() {
        this.endOfWord = true;
    }
}
