package pda.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import pda.automaton.Automaton;
import pda.validation.Violation;

import java.util.ArrayList;
import java.util.List;

/**
 * Data Transfer Object for {@code validate --json}.
 *
 * Example JSON output:
 * {
 *   "source": "bad.yaml",
 *   "valid": false,
 *   "states": 2,
 *   "transitions": 2,
 *   "violations": [
 *     {"kind": "UNKNOWN_STATE", "subject": "q9", "message": "Transition 2 (...): target state 'q9' is not a declared state"}
 *   ]
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationReport {

    private static final ObjectMapper mapper = new ObjectMapper();

    @JsonProperty("source")
    private String source;

    @JsonProperty("valid")
    private boolean valid;

    @JsonProperty("states")
    private int states;

    @JsonProperty("transitions")
    private int transitions;

    @JsonProperty("violations") // empty when valid
    private List<Violation> violations;

    public ValidationReport() {
    }

    public static ValidationReport from(String source, Automaton.Builder candidate, List<Violation> violations) {
        ValidationReport report = new ValidationReport();
        report.source = source;
        report.valid = violations.isEmpty();
        report.states = candidate.getStates().size();
        report.transitions = candidate.getTransitions().size();
        report.violations = new ArrayList<>(violations);
        return report;
    }

    public String toJson() throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(this);
    }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public boolean isValid() { return valid; }
    public void setValid(boolean valid) { this.valid = valid; }

    public int getStates() { return states; }
    public void setStates(int states) { this.states = states; }

    public int getTransitions() { return transitions; }
    public void setTransitions(int transitions) { this.transitions = transitions; }

    public List<Violation> getViolations() { return violations; }
    public void setViolations(List<Violation> violations) { this.violations = violations; }
}
