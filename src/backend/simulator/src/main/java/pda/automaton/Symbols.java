package pda.automaton;

import java.util.*;

/**
 * Helpers around the epsilon control symbol.
 *
 * Inside the model epsilon is always represented by {@code null} in the read/pop position of a
 * {@link Transition} and by an empty push list. The textual spellings below are only accepted at
 * the edges (loader, builder) and normalized away.
 */
public final class Symbols {

    public static final String EPSILON = "ε";

    private static final Set<String> EPSILON_SPELLINGS = new HashSet<>(Arrays.asList("ε", "eps", "epsilon", "λ", ""));

    private Symbols() {
    }

    public static boolean isEpsilon(String symbol) {
        return symbol == null || EPSILON_SPELLINGS.contains(symbol.trim());
    }

    /**
     * Map any epsilon spelling to {@code null}, leave concrete symbols trimmed.
     */
    public static String normalize(String symbol) {
        return isEpsilon(symbol) ? null : symbol.trim();
    }

    public static String display(String symbol) {
        return symbol == null ? EPSILON : symbol;
    }

    public static String display(List<String> symbols) {
        if (symbols == null || symbols.isEmpty()) return EPSILON;
        return String.join("", symbols);
    }
}
