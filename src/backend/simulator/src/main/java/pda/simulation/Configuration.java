package pda.simulation;

import pda.automaton.Automaton;
import pda.automaton.Symbols;

import java.util.*;

/**
 * Instantaneous description of a PDA run: (state, unread input, stack).
 *
 * Value semantics: never mutated, every step produces a new instance. equals/hashCode compare
 * the state, the content of the remaining input and the stack content, which is exactly the
 * fingerprint the search uses to avoid expanding a configuration twice.
 */
public final class Configuration {

    private final String state;
    private final List<String> input;
    private final int position;
    private final SymbolStack stack;

    private Configuration(String state, List<String> input, int position, SymbolStack stack) {
        if (position < 0 || position > input.size()) {
            throw new IllegalArgumentException("Input position " + position + " outside 0.." + input.size());
        }
        this.state = Objects.requireNonNull(state, "state");
        this.input = input;
        this.position = position;
        this.stack = Objects.requireNonNull(stack, "stack");
    }

    /**
     * The remaining input is copied, so later changes to the caller's list do not reach this instance.
     */
    public Configuration(String state, List<String> remainingInput, SymbolStack stack) {
        this(state, Collections.unmodifiableList(new ArrayList<>(remainingInput)), 0, stack);
    }

    /**
     * Start configuration (q0, w, [Z0]).
     */
    public static Configuration initial(Automaton automaton, List<String> input) {
        List<String> tape = Collections.unmodifiableList(new ArrayList<>(input));
        return new Configuration(automaton.getInitialState(), tape, 0,
                SymbolStack.empty().push(automaton.getInitialStackSymbol()));
    }

    public String getState() {
        return state;
    }

    /**
     * Suffix view of the input that is still unread.
     */
    public List<String> getRemainingInput() {
        return input.subList(position, input.size());
    }

    /**
     * Number of symbols already consumed from the original input.
     */
    public int getConsumed() {
        return position;
    }

    public SymbolStack getStack() {
        return stack;
    }

    public boolean isInputEmpty() {
        return position == input.size();
    }

    /**
     * @return next unread symbol or {@code null} when the input is exhausted
     */
    public String nextInputSymbol() {
        return isInputEmpty() ? null : input.get(position);
    }

    Configuration next(String newState, boolean consume, SymbolStack newStack) {
        return new Configuration(newState, input, consume ? position + 1 : position, newStack);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Configuration)) return false;
        Configuration that = (Configuration) o;
        return state.equals(that.state)
                && input.size() - position == that.input.size() - that.position
                && stack.equals(that.stack)
                && getRemainingInput().equals(that.getRemainingInput());
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, getRemainingInput(), stack);
    }

    @Override
    public String toString() {
        return "(" + state + ", " + Symbols.display(getRemainingInput()) + ", " + stack + ")";
    }
}
