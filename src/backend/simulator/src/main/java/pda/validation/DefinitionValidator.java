package pda.validation;

import pda.automaton.Automaton;
import pda.automaton.Symbols;
import pda.automaton.Transition;
import pda.validation.Violation.Kind;

import java.util.*;

/**
 * Static structural check of a candidate definition.
 *
 * Collects every violation instead of stopping at the first one. Reachability is not checked;
 * an unreachable state is a legal part of a definition.
 */
public final class DefinitionValidator {

    private DefinitionValidator() {
    }

    public static List<Violation> validate(Automaton.Builder candidate) {
        List<Violation> violations = new ArrayList<>();

        Set<String> states = checkStates(candidate.getStates(), violations);
        Set<String> input = checkAlphabet("input", candidate.getInputAlphabet(), violations);
        Set<String> stack = checkAlphabet("stack", candidate.getStackAlphabet(), violations);

        String initial = candidate.getInitialState();
        if (initial == null || initial.isBlank()) {
            violations.add(new Violation(Kind.MISSING_INITIAL_STATE, null, "Initial state is not defined"));
        } else if (!states.contains(initial)) {
            violations.add(new Violation(Kind.UNKNOWN_STATE, initial,
                    "Initial state '" + initial + "' is not a declared state"));
        }

        String z0 = candidate.getInitialStackSymbol();
        if (z0 == null) {
            violations.add(new Violation(Kind.MISSING_INITIAL_STACK_SYMBOL, null, "Initial stack symbol is not defined"));
        } else if (Symbols.isEpsilon(z0)) {
            violations.add(new Violation(Kind.RESERVED_SYMBOL, z0,
                    "Initial stack symbol cannot be epsilon ('" + z0 + "')"));
        } else if (!stack.contains(z0)) {
            violations.add(new Violation(Kind.UNKNOWN_SYMBOL, z0,
                    "Initial stack symbol '" + z0 + "' is not in the stack alphabet"));
        }

        for (String f : candidate.getFinalStates()) {
            if (!states.contains(f)) {
                violations.add(new Violation(Kind.UNKNOWN_STATE, f,
                        "Final state '" + f + "' is not a declared state"));
            }
        }

        List<Transition> transitions = candidate.getTransitions();
        for (int i = 0; i < transitions.size(); i++) {
            checkTransition(i + 1, transitions.get(i), states, input, stack, violations);
        }
        return violations;
    }

    private static Set<String> checkStates(List<String> declared, List<Violation> violations) {
        Set<String> states = new LinkedHashSet<>();
        Set<String> reported = new HashSet<>();
        if (declared.isEmpty()) {
            violations.add(new Violation(Kind.EMPTY_STATES, null, "No states declared"));
        }
        for (String s : declared) {
            if (s == null || s.isBlank()) {
                violations.add(new Violation(Kind.RESERVED_SYMBOL, s, "State names cannot be blank"));
                continue;
            }
            if (!states.add(s) && reported.add(s)) {
                violations.add(new Violation(Kind.DUPLICATE_STATE, s, "State '" + s + "' is declared more than once"));
            }
        }
        return states;
    }

    private static Set<String> checkAlphabet(String which, List<String> declared, List<Violation> violations) {
        Set<String> alphabet = new LinkedHashSet<>();
        for (String symbol : declared) {
            if (Symbols.isEpsilon(symbol)) {
                violations.add(new Violation(Kind.RESERVED_SYMBOL, symbol,
                        "The " + which + " alphabet cannot contain the epsilon marker ('" + symbol + "')"));
                continue;
            }
            alphabet.add(symbol);
        }
        return alphabet;
    }

    private static void checkTransition(int index, Transition t, Set<String> states, Set<String> input,
                                        Set<String> stack, List<Violation> violations) {
        String where = "Transition " + index + " (" + t + ")";
        if (!states.contains(t.getFrom())) {
            violations.add(new Violation(Kind.UNKNOWN_STATE, t.getFrom(),
                    where + ": source state '" + t.getFrom() + "' is not a declared state"));
        }
        if (!states.contains(t.getTo())) {
            violations.add(new Violation(Kind.UNKNOWN_STATE, t.getTo(),
                    where + ": target state '" + t.getTo() + "' is not a declared state"));
        }
        if (t.getRead() != null && !input.contains(t.getRead())) {
            violations.add(new Violation(Kind.UNKNOWN_SYMBOL, t.getRead(),
                    where + ": read symbol '" + t.getRead() + "' is not in the input alphabet"));
        }
        if (t.getPop() != null && !stack.contains(t.getPop())) {
            violations.add(new Violation(Kind.UNKNOWN_SYMBOL, t.getPop(),
                    where + ": pop symbol '" + t.getPop() + "' is not in the stack alphabet"));
        }
        for (String symbol : t.getPush()) {
            if (Symbols.isEpsilon(symbol)) {
                violations.add(new Violation(Kind.RESERVED_SYMBOL, symbol,
                        where + ": push sequences cannot contain epsilon, push nothing instead"));
            } else if (!stack.contains(symbol)) {
                violations.add(new Violation(Kind.UNKNOWN_SYMBOL, symbol,
                        where + ": pushed symbol '" + symbol + "' is not in the stack alphabet"));
            }
        }
    }
}
