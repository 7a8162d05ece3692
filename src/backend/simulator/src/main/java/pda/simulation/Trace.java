package pda.simulation;

import java.util.*;

/**
 * Ordered path of transition applications from the start configuration to the last one.
 * Immutable once built.
 */
public final class Trace {

    private final Configuration start;
    private final List<TransitionStep> steps;

    public Trace(Configuration start, List<TransitionStep> steps) {
        this.start = Objects.requireNonNull(start, "start");
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        Configuration expected = start;
        for (TransitionStep step : this.steps) {
            if (!step.getSource().equals(expected)) {
                throw new IllegalArgumentException("Broken trace: " + step + " does not continue from " + expected);
            }
            expected = step.getTarget();
        }
    }

    public Configuration getStart() {
        return start;
    }

    public List<TransitionStep> getSteps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    public Configuration getFinalConfiguration() {
        return steps.isEmpty() ? start : steps.get(steps.size() - 1).getTarget();
    }

    /**
     * Start configuration followed by the target of every step.
     */
    public List<Configuration> configurations() {
        List<Configuration> out = new ArrayList<>(steps.size() + 1);
        out.add(start);
        for (TransitionStep step : steps) {
            out.add(step.getTarget());
        }
        return out;
    }

    /**
     * Number of steps that consumed an input symbol.
     */
    public int consumingSteps() {
        int n = 0;
        for (TransitionStep step : steps) {
            if (step.consumesInput()) n++;
        }
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Trace)) return false;
        Trace that = (Trace) o;
        return start.equals(that.start) && steps.equals(that.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, steps);
    }

    @Override
    public String toString() {
        return "Trace{steps=" + steps.size() + ", start=" + start + ", end=" + getFinalConfiguration() + "}";
    }
}
