package pda.render;

import pda.automaton.Symbols;
import pda.automaton.Transition;
import pda.simulation.Configuration;
import pda.simulation.SimulationResult;
import pda.simulation.Trace;
import pda.simulation.TransitionStep;

import java.util.*;

/**
 * Plain-text views of configurations, search frontiers and traces.
 */
public final class StepView {

    public static final String RULE = "============================================";

    private StepView() {
    }

    /**
     * Three-line block: state, remaining input, stack (top on the right).
     */
    public static String renderConfiguration(Configuration config) {
        return "State: " + config.getState() + "\n"
                + "Remaining input: " + Symbols.display(config.getRemainingInput()) + "\n"
                + "Stack (top on the right): " + renderStack(config) + "\n";
    }

    static String renderStack(Configuration config) {
        List<String> symbols = config.getStack().toList();
        return symbols.isEmpty() ? Symbols.EPSILON : String.join(" ", symbols);
    }

    /**
     * One frontier of the search, numbered when there is more than one configuration.
     */
    public static String renderFrontier(List<Configuration> configs) {
        StringBuilder sb = new StringBuilder(RULE).append('\n');
        if (configs.size() == 1) {
            sb.append(renderConfiguration(configs.get(0)));
        } else {
            for (int i = 0; i < configs.size(); i++) {
                sb.append("--- Configuration ").append(i + 1).append(" ---\n");
                sb.append(renderConfiguration(configs.get(i)));
            }
        }
        return sb.append(RULE).toString();
    }

    /**
     * Numbered list of rules, as offered to an interactive user.
     */
    public static String renderChoices(List<Transition> choices) {
        if (choices.isEmpty()) {
            return "  (no applicable transitions)";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < choices.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(String.format("  [%d] %s", i + 1, choices.get(i)));
        }
        return sb.toString();
    }

    /**
     * Start configuration followed by one line per step:
     * {@code  3. q1 -> q1 (a,A,AA)   (q1, bb, Z,A,A)}
     */
    public static String renderTrace(Trace trace) {
        StringBuilder sb = new StringBuilder();
        sb.append("  0. start").append(pad("start", 22)).append(trace.getStart()).append('\n');
        List<TransitionStep> steps = trace.getSteps();
        for (int i = 0; i < steps.size(); i++) {
            TransitionStep step = steps.get(i);
            String move = step.getTransition().toString();
            sb.append(String.format("%3d. ", i + 1)).append(move).append(pad(move, 22))
                    .append(step.getTarget()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Summary line, plus the trace when accepted.
     */
    public static String renderResult(SimulationResult result) {
        StringBuilder sb = new StringBuilder(result.describe()).append('\n');
        if (result.isAccepted()) {
            sb.append(renderTrace(result.getTrace()));
        }
        return sb.toString();
    }

    private static String pad(String text, int width) {
        int n = Math.max(1, width - text.length());
        char[] spaces = new char[n];
        Arrays.fill(spaces, ' ');
        return new String(spaces);
    }
}
