package pda.automaton;

import pda.validation.DefinitionValidator;
import pda.validation.Violation;

import java.util.*;

/**
 * Immutable pushdown automaton P = (Q, Σ, Γ, δ, q0, Z0, F).
 *
 * Instances only come out of {@link Builder#build()}, which refuses candidates that break a
 * structural invariant, so every state and symbol referenced here is declared.
 *
 * Usage:
 *   Automaton pda = Automaton.builder()
 *       .states("q")
 *       .inputAlphabet("(", ")")
 *       .stackAlphabet("Z", "(")
 *       .initialState("q")
 *       .initialStackSymbol("Z")
 *       .transition("q", "(", "Z", "q", "Z", "(")
 *       .build();
 */
public final class Automaton {

    private final Set<String> states;
    private final Set<String> inputAlphabet;
    private final Set<String> stackAlphabet;
    private final String initialState;
    private final String initialStackSymbol;
    private final Set<String> finalStates;
    private final List<Transition> transitions;

    // Per source state, rules ordered by Kind precedence, declaration order within a kind
    private final Map<String, List<Transition>> bySource;

    private Automaton(Builder builder) {
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(builder.states));
        this.inputAlphabet = Collections.unmodifiableSet(new LinkedHashSet<>(builder.inputAlphabet));
        this.stackAlphabet = Collections.unmodifiableSet(new LinkedHashSet<>(builder.stackAlphabet));
        this.initialState = builder.initialState;
        this.initialStackSymbol = builder.initialStackSymbol;
        this.finalStates = Collections.unmodifiableSet(new LinkedHashSet<>(builder.finalStates));
        this.transitions = Collections.unmodifiableList(new ArrayList<>(builder.transitions));

        Map<String, List<Transition>> index = new HashMap<>();
        for (String state : states) {
            index.put(state, new ArrayList<>());
        }
        for (Transition t : transitions) {
            index.get(t.getFrom()).add(t);
        }
        for (Map.Entry<String, List<Transition>> entry : index.entrySet()) {
            List<Transition> rules = entry.getValue();
            // List.sort is stable, so declaration order survives inside a kind
            rules.sort(Comparator.comparing(Transition::getKind));
            entry.setValue(Collections.unmodifiableList(rules));
        }
        this.bySource = Collections.unmodifiableMap(index);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> getStates() { return states; }
    public Set<String> getInputAlphabet() { return inputAlphabet; }
    public Set<String> getStackAlphabet() { return stackAlphabet; }
    public String getInitialState() { return initialState; }
    public String getInitialStackSymbol() { return initialStackSymbol; }
    public Set<String> getFinalStates() { return finalStates; }
    public List<Transition> getTransitions() { return transitions; }

    public boolean isFinal(String state) {
        return finalStates.contains(state);
    }

    /**
     * All rules leaving {@code state}, in declaration order.
     */
    public List<Transition> transitionsFrom(String state) {
        List<Transition> out = new ArrayList<>();
        for (Transition t : transitions) {
            if (t.getFrom().equals(state)) out.add(t);
        }
        return out;
    }

    /**
     * Candidate rules for a configuration, in precedence order.
     *
     * @param state current state
     * @param inputSymbol next input symbol, or {@code null} when the input is exhausted
     *                    (then only rules that read nothing are candidates)
     * @param stackTop current top, or {@code null} for an empty stack
     *                 (then only rules that pop nothing are candidates)
     * @return ordered candidates, possibly empty
     */
    public List<Transition> transitionsFrom(String state, String inputSymbol, String stackTop) {
        List<Transition> rules = bySource.get(state);
        if (rules == null || rules.isEmpty()) {
            return Collections.emptyList();
        }
        List<Transition> candidates = new ArrayList<>();
        for (Transition t : rules) {
            if (t.getRead() != null && !t.getRead().equals(inputSymbol)) continue;
            if (t.getPop() != null && !t.getPop().equals(stackTop)) continue;
            candidates.add(t);
        }
        return candidates;
    }

    /**
     * Copy this definition into a fresh builder (e.g. to derive a variant).
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.states.addAll(states);
        b.inputAlphabet.addAll(inputAlphabet);
        b.stackAlphabet.addAll(stackAlphabet);
        b.initialState = initialState;
        b.initialStackSymbol = initialStackSymbol;
        b.finalStates.addAll(finalStates);
        b.transitions.addAll(transitions);
        return b;
    }

    @Override
    public String toString() {
        return String.format("Automaton{states=%d, input=%s, stack=%s, initial=%s, Z0=%s, finals=%s, transitions=%d}",
                states.size(), inputAlphabet, stackAlphabet, initialState, initialStackSymbol, finalStates,
                transitions.size());
    }

    /**
     * Mutable candidate definition. Keeps what it is given verbatim (duplicates included) so
     * that {@link DefinitionValidator} can report every problem at once.
     */
    public static final class Builder {
        private final List<String> states = new ArrayList<>();
        private final List<String> inputAlphabet = new ArrayList<>();
        private final List<String> stackAlphabet = new ArrayList<>();
        private String initialState;
        private String initialStackSymbol;
        private final List<String> finalStates = new ArrayList<>();
        private final List<Transition> transitions = new ArrayList<>();

        public Builder states(String... names) {
            return states(Arrays.asList(names));
        }

        public Builder states(Collection<String> names) {
            if (names != null) states.addAll(names);
            return this;
        }

        public Builder inputAlphabet(String... symbols) {
            return inputAlphabet(Arrays.asList(symbols));
        }

        public Builder inputAlphabet(Collection<String> symbols) {
            if (symbols != null) inputAlphabet.addAll(symbols);
            return this;
        }

        public Builder stackAlphabet(String... symbols) {
            return stackAlphabet(Arrays.asList(symbols));
        }

        public Builder stackAlphabet(Collection<String> symbols) {
            if (symbols != null) stackAlphabet.addAll(symbols);
            return this;
        }

        public Builder initialState(String state) {
            this.initialState = state;
            return this;
        }

        public Builder initialStackSymbol(String symbol) {
            this.initialStackSymbol = symbol;
            return this;
        }

        public Builder finalStates(String... names) {
            return finalStates(Arrays.asList(names));
        }

        public Builder finalStates(Collection<String> names) {
            if (names != null) finalStates.addAll(names);
            return this;
        }

        /**
         * Add a rule; {@code read}/{@code pop} may be any epsilon spelling (or null).
         */
        public Builder transition(String from, String read, String pop, String to, String... push) {
            return transition(new Transition(from, read, pop, to, Arrays.asList(push)));
        }

        public Builder transition(String from, String read, String pop, String to, List<String> push) {
            return transition(new Transition(from, read, pop, to, push));
        }

        public Builder transition(Transition transition) {
            transitions.add(transition);
            return this;
        }

        public List<String> getStates() { return Collections.unmodifiableList(states); }
        public List<String> getInputAlphabet() { return Collections.unmodifiableList(inputAlphabet); }
        public List<String> getStackAlphabet() { return Collections.unmodifiableList(stackAlphabet); }
        public String getInitialState() { return initialState; }
        public String getInitialStackSymbol() { return initialStackSymbol; }
        public List<String> getFinalStates() { return Collections.unmodifiableList(finalStates); }
        public List<Transition> getTransitions() { return Collections.unmodifiableList(transitions); }

        public List<Violation> validate() {
            return DefinitionValidator.validate(this);
        }

        public Automaton build() throws DefinitionException {
            List<Violation> violations = validate();
            if (!violations.isEmpty()) {
                throw new DefinitionException(violations);
            }
            return new Automaton(this);
        }
    }
}
