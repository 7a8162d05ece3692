package pda.render;

import pda.automaton.Automaton;
import pda.automaton.Transition;

import java.util.*;

/**
 * Graphviz export. Final states are drawn as double circles and an invisible start node points
 * at the initial state. Rules sharing a (from, to) pair become one edge with one label line per rule.
 *
 * Usage:
 *   Files.write(Paths.get("pda.dot"), DotRenderer.render(pda).getBytes(StandardCharsets.UTF_8));
 *   // dot -Tpng pda.dot -o pda.png
 */
public final class DotRenderer {

    private static final String START_NODE = "__start";

    private DotRenderer() {
    }

    public static String render(Automaton automaton) {
        return render(automaton, "pda");
    }

    public static String render(Automaton automaton, String name) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(escapeId(name)).append(" {\n");
        sb.append("  rankdir = LR;\n");
        sb.append("  ").append(escapeId(START_NODE)).append(" [shape = none, label = \"\"];\n");

        for (String state : AsciiRenderer.sortedStates(automaton.getStates())) {
            String shape = automaton.isFinal(state) ? "doublecircle" : "circle";
            sb.append("  ").append(escapeId(state)).append(" [shape = ").append(shape).append("];\n");
        }

        sb.append("  ").append(escapeId(START_NODE)).append(" -> ").append(escapeId(automaton.getInitialState()))
                .append(" [label = ").append(escapeId(automaton.getInitialStackSymbol())).append("];\n");

        Map<List<String>, List<String>> edges = new LinkedHashMap<>();
        for (Transition t : automaton.getTransitions()) {
            edges.computeIfAbsent(Arrays.asList(t.getFrom(), t.getTo()), k -> new ArrayList<>()).add(t.label());
        }
        for (Map.Entry<List<String>, List<String>> edge : edges.entrySet()) {
            sb.append("  ").append(escapeId(edge.getKey().get(0)))
                    .append(" -> ").append(escapeId(edge.getKey().get(1)))
                    .append(" [label = ").append(escapeId(String.join("\n", edge.getValue()))).append("];\n");
        }

        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Double-quoted DOT id; quotes and backslashes escaped, newlines kept as {@code \n}.
     */
    static String escapeId(String str) {
        return "\"" + str.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
}
