package pda.loader;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import pda.automaton.Automaton;
import pda.automaton.Symbols;

import java.util.*;

/**
 * File-level shape of a definition, shared by every format.
 *
 * YAML and JSON bind to it directly; the text and CSV parsers fill it line by line. Nothing is
 * checked here beyond what the builder needs to be populated; validation happens on the builder.
 *
 * Example (YAML):
 *   states: [q0, q1]
 *   input_alphabet: [a, b]
 *   stack_alphabet: [Z, A]
 *   initial_state: q0
 *   initial_stack_symbol: Z
 *   final_states: [q1]
 *   transitions:
 *     - {from: q0, to: q0, read: a, pop: Z, push: [Z, A]}
 *     - {from: q0, to: q1, read: ε, pop: Z, push: Z}
 *
 * A push given as a list is taken element by element. A push given as a single string is split
 * on whitespace when it contains any, otherwise by the longest stack-alphabet symbol at each
 * position ("ZA" with alphabet {Z, A} is [Z, A]). The last symbol ends on top of the stack.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AutomatonDocument {

    @JsonProperty("states")
    private List<String> states;

    @JsonProperty("input_alphabet")
    private List<String> inputAlphabet;

    @JsonProperty("stack_alphabet")
    private List<String> stackAlphabet;

    @JsonProperty("initial_state")
    private String initialState;

    @JsonProperty("initial_stack_symbol")
    private String initialStackSymbol;

    // older spelling, a one-element list
    @JsonProperty("initial_stack")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> initialStack;

    @JsonProperty("final_states")
    private List<String> finalStates;

    @JsonProperty("transitions")
    private List<TransitionEntry> transitions;

    public static class TransitionEntry {
        @JsonProperty("from")
        private String from;

        @JsonProperty("to")
        private String to;

        @JsonProperty("read")
        private String read;

        @JsonProperty("pop")
        private String pop;

        @JsonProperty("push")
        private JsonNode push; // string or list

        public TransitionEntry() {
        }

        public TransitionEntry(String from, String to, String read, String pop, String push) {
            this.from = from;
            this.to = to;
            this.read = read;
            this.pop = pop;
            this.push = push == null ? null : TextNode.valueOf(push);
        }

        public String getFrom() { return from; }
        public void setFrom(String from) { this.from = from; }

        public String getTo() { return to; }
        public void setTo(String to) { this.to = to; }

        public String getRead() { return read; }
        public void setRead(String read) { this.read = read; }

        public String getPop() { return pop; }
        public void setPop(String pop) { this.pop = pop; }

        public JsonNode getPush() { return push; }
        public void setPush(JsonNode push) { this.push = push; }
    }

    public List<String> getStates() { return states; }
    public void setStates(List<String> states) { this.states = states; }

    public List<String> getInputAlphabet() { return inputAlphabet; }
    public void setInputAlphabet(List<String> inputAlphabet) { this.inputAlphabet = inputAlphabet; }

    public List<String> getStackAlphabet() { return stackAlphabet; }
    public void setStackAlphabet(List<String> stackAlphabet) { this.stackAlphabet = stackAlphabet; }

    public String getInitialState() { return initialState; }
    public void setInitialState(String initialState) { this.initialState = initialState; }

    public String getInitialStackSymbol() { return initialStackSymbol; }
    public void setInitialStackSymbol(String initialStackSymbol) { this.initialStackSymbol = initialStackSymbol; }

    public List<String> getInitialStack() { return initialStack; }
    public void setInitialStack(List<String> initialStack) { this.initialStack = initialStack; }

    public List<String> getFinalStates() { return finalStates; }
    public void setFinalStates(List<String> finalStates) { this.finalStates = finalStates; }

    public List<TransitionEntry> getTransitions() { return transitions; }
    public void setTransitions(List<TransitionEntry> transitions) { this.transitions = transitions; }

    public void addTransition(TransitionEntry entry) {
        if (transitions == null) {
            transitions = new ArrayList<>();
        }
        transitions.add(entry);
    }

    /**
     * Populate a candidate builder. Missing sections stay empty so that validation can name them.
     *
     * @throws LoadException when the initial stack keys disagree or hold more than one symbol, or
     *                       when a transition entry is incomplete or has a nested push element
     */
    public Automaton.Builder toBuilder() throws LoadException {
        Automaton.Builder builder = Automaton.builder()
                .states(orEmpty(states))
                .inputAlphabet(orEmpty(inputAlphabet))
                .stackAlphabet(orEmpty(stackAlphabet))
                .initialState(initialState)
                .initialStackSymbol(resolveInitialStackSymbol())
                .finalStates(orEmpty(finalStates));

        List<String> alphabet = orEmpty(stackAlphabet);
        List<TransitionEntry> entries = transitions == null ? Collections.<TransitionEntry>emptyList() : transitions;
        for (int i = 0; i < entries.size(); i++) {
            TransitionEntry e = entries.get(i);
            if (e == null) {
                throw new LoadException("Transition " + (i + 1) + " is empty");
            }
            if (e.getFrom() == null || e.getTo() == null) {
                throw new LoadException("Transition " + (i + 1) + " needs both 'from' and 'to'");
            }
            builder.transition(e.getFrom(), e.getRead(), e.getPop(), e.getTo(), pushSymbols(e.getPush(), alphabet, i + 1));
        }
        return builder;
    }

    private String resolveInitialStackSymbol() throws LoadException {
        String fromList = null;
        if (initialStack != null && !initialStack.isEmpty()) {
            if (initialStack.size() > 1) {
                throw new LoadException("initial_stack must hold a single symbol, got " + initialStack);
            }
            fromList = initialStack.get(0);
        }
        if (initialStackSymbol != null && fromList != null && !initialStackSymbol.equals(fromList)) {
            throw new LoadException("initial_stack_symbol '" + initialStackSymbol
                    + "' conflicts with initial_stack '" + fromList + "'");
        }
        return initialStackSymbol != null ? initialStackSymbol : fromList;
    }

    static List<String> pushSymbols(JsonNode push, List<String> stackAlphabet, int index) throws LoadException {
        if (push == null || push.isNull()) {
            return Collections.emptyList();
        }
        if (push.isArray()) {
            List<String> symbols = new ArrayList<>();
            for (JsonNode element : push) {
                if (!element.isValueNode()) {
                    throw new LoadException("Transition " + index + ": push elements must be symbols, got " + element);
                }
                symbols.add(element.asText());
            }
            if (symbols.size() == 1 && Symbols.isEpsilon(symbols.get(0))) {
                return Collections.emptyList();
            }
            return symbols;
        }
        if (push.isValueNode()) {
            return splitPush(push.asText(), stackAlphabet);
        }
        throw new LoadException("Transition " + index + ": push must be a string or a list, got " + push);
    }

    /**
     * Split a compact push spelling into stack symbols.
     */
    static List<String> splitPush(String raw, List<String> stackAlphabet) {
        if (Symbols.isEpsilon(raw)) {
            return Collections.emptyList();
        }
        String text = raw.trim();
        if (text.matches(".*\\s.*")) {
            return Arrays.asList(text.split("\\s+"));
        }
        List<String> alphabet = new ArrayList<>(stackAlphabet);
        alphabet.sort(Comparator.comparingInt(String::length).reversed());

        List<String> symbols = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            String match = null;
            for (String symbol : alphabet) {
                if (!symbol.isEmpty() && text.startsWith(symbol, i)) {
                    match = symbol;
                    break;
                }
            }
            if (match == null) {
                match = new String(Character.toChars(text.codePointAt(i)));
            }
            symbols.add(match);
            i += match.length();
        }
        return symbols;
    }

    private static List<String> orEmpty(List<String> values) {
        return values == null ? Collections.<String>emptyList() : values;
    }
}
