package domain.text;

/**
 * Supplies the Spanish query to translate.
 *
 * <p>Speech capture and transcription happen upstream; providers only read their result
 * and never fail: a missing transcript degrades to {@link #EXAMPLE_QUERY}.</p>
 */
public interface QueryTextProvider {

    /** Contains two deliberate typos ("bontas", "edat") so the review step has work to do. */
    String EXAMPLE_QUERY =
            "muéstrame las bontas que se realizaron en 21 de julio de 2025 donde la edat es mayor a 30";

    QueryTextResolution resolve();
}
