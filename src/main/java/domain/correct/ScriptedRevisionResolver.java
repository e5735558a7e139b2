package domain.correct;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Replays a fixed list of 1-based choices, one per revision in order.
 * When the script runs out, or an entry is past the end of the option list,
 * the original text (option 1) is kept.
 */
public final class ScriptedRevisionResolver implements RevisionResolver {

    private final Deque<Integer> choices;

    public ScriptedRevisionResolver(List<Integer> choices) {
        this.choices = new ArrayDeque<>(choices == null ? List.of() : choices);
    }

    public static ScriptedRevisionResolver of(Integer... choices) {
        return new ScriptedRevisionResolver(List.of(choices));
    }

    @Override
    public int choose(Revision revision, List<String> options) {
        Integer next = choices.poll();
        if (next == null) return 1;
        if (next < 1 || next > options.size()) {
            System.out.println("[WARN] scripted choice " + next + " out of range for '" + revision.getOriginal()
                    + "' (1-" + options.size() + ") => keeping original.");
            return 1;
        }
        return next;
    }
}
