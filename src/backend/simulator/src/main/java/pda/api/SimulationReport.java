package pda.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import pda.automaton.Symbols;
import pda.simulation.SimulationResult;
import pda.simulation.TransitionStep;

import java.util.ArrayList;
import java.util.List;

/**
 * Data Transfer Object for a simulation result, as printed by {@code run --json}.
 *
 * Example JSON output:
 * {
 *   "outcome": "ACCEPTED",
 *   "acceptanceMode": "empty_stack",
 *   "expansions": 5,
 *   "visited": 6,
 *   "steps": [
 *     {"from": "q", "read": "(", "pop": "Z", "push": ["Z", "("], "to": "q",
 *      "remainingInput": [")"], "stack": ["Z", "("]},
 *     ...
 *   ]
 * }
 *
 * Stacks are listed bottom to top. Epsilon read/pop are written as "ε". Steps are only present
 * for accepted runs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SimulationReport {

    private static final ObjectMapper mapper = new ObjectMapper();

    @JsonProperty("outcome") // ACCEPTED | REJECTED | INCONCLUSIVE
    private String outcome;

    @JsonProperty("reason")
    private String reason;

    @JsonProperty("acceptanceMode")
    private String acceptanceMode;

    @JsonProperty("stepLimit")
    private Integer stepLimit;

    @JsonProperty("expansions")
    private int expansions;

    @JsonProperty("visited")
    private int visited;

    @JsonProperty("steps")
    private List<StepInfo> steps;

    /**
     * One applied rule and the configuration it led to.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StepInfo {
        @JsonProperty("from")
        private String from;

        @JsonProperty("read")
        private String read;

        @JsonProperty("pop")
        private String pop;

        @JsonProperty("push")
        private List<String> push;

        @JsonProperty("to")
        private String to;

        @JsonProperty("remainingInput")
        private List<String> remainingInput;

        @JsonProperty("stack")
        private List<String> stack;

        public StepInfo() {
        }

        static StepInfo of(TransitionStep step) {
            StepInfo info = new StepInfo();
            info.from = step.getTransition().getFrom();
            info.read = Symbols.display(step.getRead());
            info.pop = Symbols.display(step.getPop());
            info.push = new ArrayList<>(step.getTransition().getPush());
            info.to = step.getTransition().getTo();
            info.remainingInput = new ArrayList<>(step.getTarget().getRemainingInput());
            info.stack = step.getTarget().getStack().toList();
            return info;
        }

        public String getFrom() { return from; }
        public void setFrom(String from) { this.from = from; }

        public String getRead() { return read; }
        public void setRead(String read) { this.read = read; }

        public String getPop() { return pop; }
        public void setPop(String pop) { this.pop = pop; }

        public List<String> getPush() { return push; }
        public void setPush(List<String> push) { this.push = push; }

        public String getTo() { return to; }
        public void setTo(String to) { this.to = to; }

        public List<String> getRemainingInput() { return remainingInput; }
        public void setRemainingInput(List<String> remainingInput) { this.remainingInput = remainingInput; }

        public List<String> getStack() { return stack; }
        public void setStack(List<String> stack) { this.stack = stack; }
    }

    public SimulationReport() {
    }

    public static SimulationReport from(SimulationResult result) {
        SimulationReport report = new SimulationReport();
        report.outcome = result.getOutcome().name();
        report.reason = result.getReason();
        report.acceptanceMode = result.getOptions().getAcceptanceMode().externalName();
        report.stepLimit = result.getStepLimit();
        report.expansions = result.getExpansions();
        report.visited = result.getVisited();
        if (result.isAccepted()) {
            report.steps = new ArrayList<>();
            for (TransitionStep step : result.getTrace().getSteps()) {
                report.steps.add(StepInfo.of(step));
            }
        }
        return report;
    }

    public String toJson() throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(this);
    }

    public String getOutcome() { return outcome; }
    public void setOutcome(String outcome) { this.outcome = outcome; }

    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }

    public String getAcceptanceMode() { return acceptanceMode; }
    public void setAcceptanceMode(String acceptanceMode) { this.acceptanceMode = acceptanceMode; }

    public Integer getStepLimit() { return stepLimit; }
    public void setStepLimit(Integer stepLimit) { this.stepLimit = stepLimit; }

    public int getExpansions() { return expansions; }
    public void setExpansions(int expansions) { this.expansions = expansions; }

    public int getVisited() { return visited; }
    public void setVisited(int visited) { this.visited = visited; }

    public List<StepInfo> getSteps() { return steps; }
    public void setSteps(List<StepInfo> steps) { this.steps = steps; }
}
