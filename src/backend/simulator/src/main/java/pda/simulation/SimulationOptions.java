package pda.simulation;

import pda.simulation.SimulationEnums.AcceptanceMode;

import java.util.Objects;

/**
 * Caller-visible knobs of a run.
 *
 * Defaults: acceptance by {@link AcceptanceMode#FINAL_STATE}, no step limit. The two classical
 * acceptance conventions are not interchangeable, so callers that build automata for empty-stack
 * acceptance have to ask for it explicitly.
 */
public final class SimulationOptions {

    public static final AcceptanceMode DEFAULT_ACCEPTANCE_MODE = AcceptanceMode.FINAL_STATE;

    private final AcceptanceMode acceptanceMode;
    private final Integer stepLimit;

    private SimulationOptions(AcceptanceMode acceptanceMode, Integer stepLimit) {
        this.acceptanceMode = Objects.requireNonNull(acceptanceMode, "acceptanceMode");
        if (stepLimit != null && stepLimit <= 0) {
            throw new IllegalArgumentException("Step limit must be a positive integer, got " + stepLimit);
        }
        this.stepLimit = stepLimit;
    }

    public static SimulationOptions defaults() {
        return new SimulationOptions(DEFAULT_ACCEPTANCE_MODE, null);
    }

    public static SimulationOptions of(AcceptanceMode mode) {
        return new SimulationOptions(mode, null);
    }

    public static SimulationOptions of(AcceptanceMode mode, Integer stepLimit) {
        return new SimulationOptions(mode, stepLimit);
    }

    public SimulationOptions withAcceptanceMode(AcceptanceMode mode) {
        return new SimulationOptions(mode, stepLimit);
    }

    /**
     * @param limit positive limit on expansions, or {@code null} for unbounded
     */
    public SimulationOptions withStepLimit(Integer limit) {
        return new SimulationOptions(acceptanceMode, limit);
    }

    public AcceptanceMode getAcceptanceMode() {
        return acceptanceMode;
    }

    /**
     * @return the limit, or {@code null} when unbounded
     */
    public Integer getStepLimit() {
        return stepLimit;
    }

    public boolean hasStepLimit() {
        return stepLimit != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimulationOptions)) return false;
        SimulationOptions that = (SimulationOptions) o;
        return acceptanceMode == that.acceptanceMode && Objects.equals(stepLimit, that.stepLimit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(acceptanceMode, stepLimit);
    }

    @Override
    public String toString() {
        return "SimulationOptions{mode=" + acceptanceMode.externalName()
                + ", stepLimit=" + (stepLimit == null ? "unbounded" : stepLimit) + "}";
    }
}
