package domain.vocabulary;

import java.nio.file.Path;

/**
 * Reads a schema description file into a vocabulary {@link Trie}.
 *
 * <p>Implementations throw {@link IllegalArgumentException} when the file does not exist
 * and {@link IllegalStateException} when it cannot be read.</p>
 */
public interface SchemaVocabularySource {
    Trie load(Path path);
}
