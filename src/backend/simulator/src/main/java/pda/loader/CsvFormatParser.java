package pda.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Tabular definition format (.csv): metadata lines, then a transition table.
 *
 * <pre>
 * #META,states,q0;q1;q2
 * #META,input_alphabet,a;b
 * #META,stack_alphabet,Z;X
 * #META,initial_state,q0
 * #META,initial_stack,Z
 * #META,final_states,q2
 * from,to,read,pop,push
 * q0,q1,a,Z,ZX
 * q1,q2,ε,X,ε
 * </pre>
 *
 * Other lines starting with {@code #} are comments.
 */
final class CsvFormatParser {

    private static final Logger logger = LoggerFactory.getLogger(CsvFormatParser.class);

    private static final String META = "#META";

    private CsvFormatParser() {
    }

    static AutomatonDocument parse(List<String> lines, String source) throws LoadException {
        AutomatonDocument doc = new AutomatonDocument();
        doc.setTransitions(new ArrayList<>());
        boolean headerSeen = false;

        for (int n = 1; n <= lines.size(); n++) {
            String line = lines.get(n - 1).trim();
            if (line.isEmpty()) {
                continue;
            }

            if (line.startsWith(META)) {
                String[] parts = line.split(",", 3);
                if (parts.length < 3) {
                    throw new LoadException(source + ":" + n + ": malformed metadata line, expected '#META,key,values'");
                }
                meta(doc, parts[1].trim(), splitValues(parts[2]), source, n);
                continue;
            }
            if (line.startsWith("#")) {
                continue;
            }

            if (!headerSeen) {
                if (line.toLowerCase(Locale.ROOT).startsWith("from")) {
                    headerSeen = true;
                } else {
                    logger.warn("{}:{}: skipping line before the 'from,to,read,pop,push' header", source, n);
                }
                continue;
            }

            String[] cells = line.split(",", -1);
            if (cells.length < 5) {
                throw new LoadException(source + ":" + n + ": expected 5 columns (from,to,read,pop,push), got " + cells.length);
            }
            doc.addTransition(new AutomatonDocument.TransitionEntry(
                    cells[0].trim(), cells[1].trim(), cells[2].trim(), cells[3].trim(), cells[4].trim()));
        }
        return doc;
    }

    private static void meta(AutomatonDocument doc, String key, List<String> values, String source, int n) {
        switch (key) {
            case "states":
                doc.setStates(values);
                break;
            case "input_alphabet":
                doc.setInputAlphabet(values);
                break;
            case "stack_alphabet":
                doc.setStackAlphabet(values);
                break;
            case "initial_state":
                doc.setInitialState(values.isEmpty() ? null : values.get(0));
                break;
            case "initial_stack":
            case "initial_stack_symbol":
                doc.setInitialStack(values);
                break;
            case "final_states":
                doc.setFinalStates(values);
                break;
            default:
                logger.warn("{}:{}: ignoring unknown metadata key '{}'", source, n, key);
        }
    }

    private static List<String> splitValues(String value) {
        List<String> values = new ArrayList<>();
        for (String v : value.split(";")) {
            if (!v.trim().isEmpty()) {
                values.add(v.trim());
            }
        }
        return values;
    }
}
