package pda;

import pda.automaton.Automaton;
import pda.automaton.DefinitionException;

/**
 * Small definitions shared by the tests.
 */
public final class SampleAutomata {

    private SampleAutomata() {
    }

    /** Balanced parentheses, meant for empty-stack acceptance. */
    public static Automaton parens() throws DefinitionException {
        return Automaton.builder()
                .states("q")
                .inputAlphabet("(", ")")
                .stackAlphabet("Z", "(")
                .initialState("q")
                .initialStackSymbol("Z")
                .transition("q", "(", "Z", "q", "Z", "(")
                .transition("q", "(", "(", "q", "(", "(")
                .transition("q", ")", "(", "q")
                .transition("q", "ε", "Z", "q")
                .build();
    }

    /** a^n b^n (n >= 0), accepted in final state q2. */
    public static Automaton anbn() throws DefinitionException {
        return Automaton.builder()
                .states("q0", "q1", "q2")
                .inputAlphabet("a", "b")
                .stackAlphabet("Z", "A")
                .initialState("q0")
                .initialStackSymbol("Z")
                .finalStates("q2")
                .transition("q0", "a", "Z", "q0", "Z", "A")
                .transition("q0", "a", "A", "q0", "A", "A")
                .transition("q0", "b", "A", "q1")
                .transition("q1", "b", "A", "q1")
                .transition("q1", "ε", "Z", "q2", "Z")
                .transition("q0", "ε", "Z", "q2", "Z")
                .build();
    }

    /** Two states bouncing on epsilon moves that never touch the stack; nothing is final. */
    public static Automaton epsilonCycle() throws DefinitionException {
        return Automaton.builder()
                .states("p", "q")
                .inputAlphabet("a")
                .stackAlphabet("Z")
                .initialState("p")
                .initialStackSymbol("Z")
                .transition("p", "ε", "ε", "q")
                .transition("q", "ε", "ε", "p")
                .build();
    }

    /** Pushes forever without ever repeating a configuration; nothing is final. */
    public static Automaton unboundedPush() throws DefinitionException {
        return Automaton.builder()
                .states("q")
                .inputAlphabet("a")
                .stackAlphabet("Z", "A")
                .initialState("q")
                .initialStackSymbol("Z")
                .transition("q", "ε", "ε", "q", "A")
                .build();
    }
}
