package domain.correct;

import java.util.List;

/** Non-interactive: takes the best-ranked suggestion, or keeps the original when there is none. */
public final class AutoSuggestRevisionResolver implements RevisionResolver {

    @Override
    public int choose(Revision revision, List<String> options) {
        return options.size() > 1 ? 2 : 1;
    }
}
