package pda.simulation;

import pda.automaton.Automaton;
import pda.automaton.Transition;

import java.util.List;

/**
 * The transition application primitive shared by the search engine and interactive stepping.
 */
public final class Transitions {

    private Transitions() {
    }

    /**
     * Rules applicable to {@code config}, in precedence order
     * (input+stack, input only, stack only, pure epsilon; declaration order inside each).
     */
    public static List<Transition> applicable(Automaton automaton, Configuration config) {
        return automaton.transitionsFrom(config.getState(), config.nextInputSymbol(), config.getStack().peek());
    }

    public static boolean isApplicable(Transition t, Configuration config) {
        if (!t.getFrom().equals(config.getState())) {
            return false;
        }
        if (t.getRead() != null && !t.getRead().equals(config.nextInputSymbol())) {
            return false;
        }
        // an empty stack has no top, so any concrete pop fails here
        return t.getPop() == null || t.getPop().equals(config.getStack().peek());
    }

    /**
     * Apply a rule: pop the matched top (if the rule names one), push the rule's sequence,
     * consume the matched input symbol (if the rule reads one) and move to the target state.
     *
     * @throws IllegalArgumentException if the rule does not apply to {@code config}
     */
    public static Configuration apply(Configuration config, Transition t) {
        if (!isApplicable(t, config)) {
            throw new IllegalArgumentException("Transition " + t + " is not applicable to " + config);
        }
        SymbolStack stack = config.getStack();
        if (t.getPop() != null) {
            stack = stack.pop();
        }
        stack = stack.push(t.getPush());
        return config.next(t.getTo(), t.getRead() != null, stack);
    }
}
