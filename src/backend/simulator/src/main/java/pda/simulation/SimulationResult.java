package pda.simulation;

import pda.simulation.SimulationEnums.EngineState;
import pda.simulation.SimulationEnums.Outcome;

import java.util.Objects;

/**
 * Outcome of one {@link SimulationEngine#run} call.
 *
 * ACCEPTED carries the trace; REJECTED and INCONCLUSIVE carry a human readable reason
 * (the outcome doubles as the error kind). INCONCLUSIVE additionally reports the step limit
 * that was hit so the caller can raise it and retry.
 */
public final class SimulationResult {

    public static final String REASON_REJECTED = "no accepting configuration reachable";
    public static final String REASON_STEP_LIMIT = "step limit exceeded";

    private final Outcome outcome;
    private final Trace trace;
    private final String reason;
    private final SimulationOptions options;
    private final int expansions;
    private final int visited;

    private SimulationResult(Outcome outcome, Trace trace, String reason, SimulationOptions options,
                             int expansions, int visited) {
        this.outcome = outcome;
        this.trace = trace;
        this.reason = reason;
        this.options = options;
        this.expansions = expansions;
        this.visited = visited;
    }

    public static SimulationResult accepted(Trace trace, SimulationOptions options, int expansions, int visited) {
        return new SimulationResult(Outcome.ACCEPTED, Objects.requireNonNull(trace, "trace"), null, options,
                expansions, visited);
    }

    public static SimulationResult rejected(SimulationOptions options, int expansions, int visited) {
        return new SimulationResult(Outcome.REJECTED, null, REASON_REJECTED, options, expansions, visited);
    }

    public static SimulationResult inconclusive(SimulationOptions options, int expansions, int visited) {
        return new SimulationResult(Outcome.INCONCLUSIVE, null, REASON_STEP_LIMIT, options, expansions, visited);
    }

    public Outcome getOutcome() { return outcome; }

    /**
     * @return the accepting trace, or {@code null} unless accepted
     */
    public Trace getTrace() { return trace; }

    /**
     * @return rejection/inconclusive reason, or {@code null} when accepted
     */
    public String getReason() { return reason; }

    public SimulationOptions getOptions() { return options; }

    /**
     * @return the step limit that stopped the run (only meaningful when inconclusive)
     */
    public Integer getStepLimit() { return options.getStepLimit(); }

    /** Configurations expanded (successors generated) during the run. */
    public int getExpansions() { return expansions; }

    /** Distinct configurations discovered during the run. */
    public int getVisited() { return visited; }

    public boolean isAccepted() { return outcome == Outcome.ACCEPTED; }

    public EngineState getEngineState() {
        switch (outcome) {
            case ACCEPTED:
                return EngineState.ACCEPTED;
            case REJECTED:
                return EngineState.REJECTED;
            default:
                return EngineState.INCONCLUSIVE;
        }
    }

    /**
     * One-line message suitable for the CLI.
     */
    public String describe() {
        switch (outcome) {
            case ACCEPTED:
                return "ACCEPTED (" + trace.size() + " steps, mode=" + options.getAcceptanceMode().externalName() + ")";
            case REJECTED:
                return "REJECTED: " + reason + " (mode=" + options.getAcceptanceMode().externalName()
                        + ", explored " + visited + " configurations)";
            default:
                return "INCONCLUSIVE: " + reason + " (limit=" + options.getStepLimit()
                        + "); raise --step-limit and retry";
        }
    }

    @Override
    public String toString() {
        return String.format("SimulationResult{outcome=%s, steps=%s, reason=%s, expansions=%d, visited=%d}",
                outcome, trace != null ? trace.size() : "-", reason, expansions, visited);
    }
}
