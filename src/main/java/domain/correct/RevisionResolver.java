package domain.correct;

import java.util.List;

/**
 * Decides how an unresolved identifier is corrected.
 *
 * <p>{@code options} always starts with the original text, followed by the ranked
 * suggestions. Implementations return a 1-based position into {@code options}.
 * The console implementation blocks on the user; scripted ones let tests and batch
 * runs drive the corrector deterministically.</p>
 */
public interface RevisionResolver {

    int choose(Revision revision, List<String> options);
}
