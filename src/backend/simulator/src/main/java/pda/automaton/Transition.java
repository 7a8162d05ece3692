package pda.automaton;

import java.util.*;

/**
 * A single rule (from, read, pop) -> (to, push) of the transition relation.
 *
 * {@code read == null} means the rule does not consume input, {@code pop == null} means it does
 * not look at (nor pop) the stack top. The push sequence is pushed left to right, so its last
 * symbol ends up on top.
 */
public final class Transition {

    /**
     * Which parts of the rule are epsilon. Declaration order is the precedence order in which
     * applicable rules are tried.
     */
    public enum Kind {
        INPUT_AND_STACK,
        INPUT_ONLY,
        STACK_ONLY,
        EPSILON;

        public static Kind of(String read, String pop) {
            if (read != null) {
                return pop != null ? INPUT_AND_STACK : INPUT_ONLY;
            }
            return pop != null ? STACK_ONLY : EPSILON;
        }

        public boolean consumesInput() {
            return this == INPUT_AND_STACK || this == INPUT_ONLY;
        }

        public boolean popsStack() {
            return this == INPUT_AND_STACK || this == STACK_ONLY;
        }
    }

    private final String from;
    private final String read;
    private final String pop;
    private final String to;
    private final List<String> push;
    private final Kind kind;

    public Transition(String from, String read, String pop, String to, List<String> push) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.read = Symbols.normalize(read);
        this.pop = Symbols.normalize(pop);
        this.push = push == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(push));
        this.kind = Kind.of(this.read, this.pop);
    }

    public String getFrom() { return from; }
    public String getRead() { return read; }
    public String getPop() { return pop; }
    public String getTo() { return to; }
    public List<String> getPush() { return push; }
    public Kind getKind() { return kind; }

    /**
     * Label used by renderers: {@code (read,pop,push)} with ε for the empty parts.
     */
    public String label() {
        return "(" + Symbols.display(read) + "," + Symbols.display(pop) + "," + Symbols.display(push) + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transition)) return false;
        Transition that = (Transition) o;
        return from.equals(that.from)
                && Objects.equals(read, that.read)
                && Objects.equals(pop, that.pop)
                && to.equals(that.to)
                && push.equals(that.push);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, read, pop, to, push);
    }

    @Override
    public String toString() {
        return from + " -> " + to + " " + label();
    }
}
