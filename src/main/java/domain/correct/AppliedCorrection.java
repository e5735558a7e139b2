package domain.correct;

import java.util.List;

/** What was offered for one {@link Revision} and what was chosen. */
public final class AppliedCorrection {

    private final Revision revision;
    private final List<String> options;
    private final String chosen;

    public AppliedCorrection(Revision revision, List<String> options, String chosen) {
        this.revision = revision;
        this.options = List.copyOf(options);
        this.chosen = chosen;
    }

    public Revision getRevision() {
        return revision;
    }

    /** Original text first, then the suggestions. */
    public List<String> getOptions() {
        return options;
    }

    public String getChosen() {
        return chosen;
    }

    public boolean isChanged() {
        return !revision.getOriginal().equals(chosen);
    }
}
