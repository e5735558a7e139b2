package domain.correct;

import java.util.Objects;

/**
 * One identifier of the structured query that is not in the schema vocabulary.
 *
 * <p>{@code index} points into the attributes-to-show list or the condition list;
 * it is -1 for {@link RevisionKind#ENTITY}.</p>
 */
public final class Revision {

    private final RevisionKind kind;
    private final String original;
    private final int index;

    public Revision(RevisionKind kind, String original, int index) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.original = Objects.requireNonNull(original, "original");
        this.index = index;
    }

    public static Revision entity(String original) {
        return new Revision(RevisionKind.ENTITY, original, -1);
    }

    public RevisionKind getKind() {
        return kind;
    }

    public String getOriginal() {
        return original;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Revision that)) return false;
        return kind == that.kind && index == that.index && original.equals(that.original);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, original, index);
    }

    @Override
    public String toString() {
        return kind.label() + "[" + index + "]='" + original + "'";
    }
}
