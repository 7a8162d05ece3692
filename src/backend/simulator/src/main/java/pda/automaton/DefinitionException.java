package pda.automaton;

import pda.validation.Violation;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Raised when a candidate definition breaks one or more structural invariants.
 * Carries every violation found, not only the first one.
 */
public class DefinitionException extends Exception {

    private final List<Violation> violations;

    public DefinitionException(List<Violation> violations) {
        super(describe(violations));
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public List<Violation> getViolations() {
        return violations;
    }

    private static String describe(List<Violation> violations) {
        if (violations.size() == 1) {
            return "Invalid automaton definition: " + violations.get(0).getMessage();
        }
        return "Invalid automaton definition (" + violations.size() + " violations): "
                + violations.stream().map(Violation::getMessage).collect(Collectors.joining("; "));
    }
}
