package pda.simulation;

import pda.automaton.Transition;

import java.util.Objects;

/**
 * One edge of a trace: {@code source --transition--> target}.
 * The consumed (read, pop) pair is the transition's own read/pop, {@code null} meaning ε.
 */
public final class TransitionStep {

    private final Configuration source;
    private final Transition transition;
    private final Configuration target;

    public TransitionStep(Configuration source, Transition transition, Configuration target) {
        this.source = Objects.requireNonNull(source, "source");
        this.transition = Objects.requireNonNull(transition, "transition");
        this.target = Objects.requireNonNull(target, "target");
    }

    public Configuration getSource() { return source; }
    public Transition getTransition() { return transition; }
    public Configuration getTarget() { return target; }

    public String getRead() { return transition.getRead(); }
    public String getPop() { return transition.getPop(); }

    public boolean consumesInput() {
        return transition.getRead() != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransitionStep)) return false;
        TransitionStep that = (TransitionStep) o;
        return source.equals(that.source) && transition.equals(that.transition) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, transition, target);
    }

    @Override
    public String toString() {
        return source + " ⊢ " + target + " via " + transition;
    }
}
