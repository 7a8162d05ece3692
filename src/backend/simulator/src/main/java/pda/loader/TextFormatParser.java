package pda.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented definition format (.txt, .pda, .ascii).
 *
 * <pre>
 * # comment
 * STATES: q0, q1, q2
 * INPUT: a, b
 * STACK: Z, X
 * INITIAL: q0
 * INITIAL_STACK: Z
 * FINAL: q2
 *
 * q0 -> q1 [read=a, pop=Z, push=ZX]
 * q1 -> q2 [read=ε, pop=X, push=ε]
 * </pre>
 *
 * Omitted read/pop/push parameters mean epsilon.
 */
final class TextFormatParser {

    private static final Logger logger = LoggerFactory.getLogger(TextFormatParser.class);

    private static final Pattern TRANSITION = Pattern.compile("^(\\S+)\\s*->\\s*(\\S+)\\s*\\[([^\\]]*)\\]$");
    private static final Pattern INLINE_COMMENT = Pattern.compile("\\s+#.*$");

    private TextFormatParser() {
    }

    static AutomatonDocument parse(List<String> lines, String source) throws LoadException {
        AutomatonDocument doc = new AutomatonDocument();
        doc.setTransitions(new ArrayList<>());

        for (int n = 1; n <= lines.size(); n++) {
            String line = INLINE_COMMENT.matcher(lines.get(n - 1)).replaceFirst("").trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            Matcher m = TRANSITION.matcher(line);
            if (m.matches()) {
                doc.addTransition(transition(m.group(1), m.group(2), m.group(3), source, n));
                continue;
            }
            if (line.contains("->")) {
                throw new LoadException(source + ":" + n + ": malformed transition '" + line
                        + "', expected 'from -> to [read=.., pop=.., push=..]'");
            }

            int colon = line.indexOf(':');
            if (colon < 0) {
                throw new LoadException(source + ":" + n + ": unrecognized line '" + line + "'");
            }
            String key = line.substring(0, colon).trim().toUpperCase(Locale.ROOT);
            List<String> values = splitList(line.substring(colon + 1));

            switch (key) {
                case "STATES":
                    doc.setStates(values);
                    break;
                case "INPUT":
                    doc.setInputAlphabet(values);
                    break;
                case "STACK":
                    doc.setStackAlphabet(values);
                    break;
                case "INITIAL":
                    doc.setInitialState(values.isEmpty() ? null : values.get(0));
                    break;
                case "INITIAL_STACK":
                case "INITIAL_STACK_SYMBOL":
                    doc.setInitialStack(values);
                    break;
                case "FINAL":
                    doc.setFinalStates(values);
                    break;
                default:
                    throw new LoadException(source + ":" + n + ": unknown key '" + key + "'");
            }
        }
        return doc;
    }

    private static AutomatonDocument.TransitionEntry transition(String from, String to, String params,
                                                                String source, int n) {
        String read = null;
        String pop = null;
        String push = null;
        for (String param : params.split(",")) {
            String p = param.trim();
            if (p.isEmpty()) {
                continue;
            }
            int eq = p.indexOf('=');
            if (eq < 0) {
                logger.warn("{}:{}: ignoring parameter '{}' without a value", source, n, p);
                continue;
            }
            String key = p.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            String value = p.substring(eq + 1).trim();
            switch (key) {
                case "read":
                    read = value;
                    break;
                case "pop":
                    pop = value;
                    break;
                case "push":
                    push = value;
                    break;
                default:
                    logger.warn("{}:{}: ignoring unknown parameter '{}'", source, n, key);
            }
        }
        return new AutomatonDocument.TransitionEntry(from, to, read, pop, push);
    }

    private static List<String> splitList(String value) {
        List<String> values = new ArrayList<>();
        for (String v : value.split(",")) {
            if (!v.trim().isEmpty()) {
                values.add(v.trim());
            }
        }
        return values;
    }
}
