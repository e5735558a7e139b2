package domain.text;

/**
 * Where the Spanish query text came from.
 * <ul>
 *   <li>{@link #ARGUMENT}: --query option</li>
 *   <li>{@link #FILE}: transcript file written by the speech-to-text step</li>
 *   <li>{@link #EXAMPLE}: fixed example query (transcript missing)</li>
 * </ul>
 */
public enum QueryTextSource {
    ARGUMENT,
    FILE,
    EXAMPLE
}
