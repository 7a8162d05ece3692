package pda.simulation;

import pda.automaton.Automaton;

import java.util.*;

/**
 * Splits a raw input string into input symbols.
 *
 * Strings containing whitespace are split on whitespace ("push pop pop"). Otherwise the
 * longest input-alphabet symbol matching at the current position wins; text that no symbol
 * matches becomes a single code point symbol, which no rule can consume.
 */
public final class InputTokenizer {

    private InputTokenizer() {
    }

    public static List<String> tokenize(String input, Automaton automaton) {
        if (input == null || input.isEmpty()) {
            return Collections.emptyList();
        }
        String trimmed = input.trim();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }
        if (containsWhitespace(trimmed)) {
            return Arrays.asList(trimmed.split("\\s+"));
        }

        List<String> alphabet = new ArrayList<>(automaton.getInputAlphabet());
        alphabet.sort(Comparator.comparingInt(String::length).reversed());

        List<String> tokens = new ArrayList<>();
        int i = 0;
        while (i < trimmed.length()) {
            String match = null;
            for (String symbol : alphabet) {
                if (trimmed.startsWith(symbol, i)) {
                    match = symbol;
                    break;
                }
            }
            if (match == null) {
                int cp = trimmed.codePointAt(i);
                match = new String(Character.toChars(cp));
            }
            tokens.add(match);
            i += match.length();
        }
        return tokens;
    }

    private static boolean containsWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) return true;
        }
        return false;
    }
}
