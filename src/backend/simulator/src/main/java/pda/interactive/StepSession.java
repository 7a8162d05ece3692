package pda.interactive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pda.automaton.Automaton;
import pda.automaton.Transition;
import pda.simulation.Configuration;
import pda.simulation.InputTokenizer;
import pda.simulation.SimulationEnums.AcceptanceMode;
import pda.simulation.Trace;
import pda.simulation.TransitionStep;
import pda.simulation.Transitions;

import java.util.*;

/**
 * Caller-driven walk through the configuration graph.
 *
 * At each configuration the caller picks one of the applicable rules (same ordering as the
 * search engine) or backtracks to the previous configuration. The path taken so far is kept as
 * a stack of {@link TransitionStep}s; nothing here searches on its own.
 */
public class StepSession {

    private static final Logger logger = LoggerFactory.getLogger(StepSession.class);

    private final Automaton automaton;
    private final AcceptanceMode mode;
    private final Configuration start;
    private final Deque<TransitionStep> path = new ArrayDeque<>();

    public StepSession(Automaton automaton, List<String> input, AcceptanceMode mode) {
        this.automaton = Objects.requireNonNull(automaton, "automaton");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.start = Configuration.initial(automaton, input);
    }

    public StepSession(Automaton automaton, String input, AcceptanceMode mode) {
        this(automaton, InputTokenizer.tokenize(input, automaton), mode);
    }

    public Automaton getAutomaton() {
        return automaton;
    }

    public AcceptanceMode getMode() {
        return mode;
    }

    public Configuration current() {
        return path.isEmpty() ? start : path.peekLast().getTarget();
    }

    public List<Transition> applicableTransitions() {
        return Transitions.applicable(automaton, current());
    }

    /**
     * Take {@code choice} from the current configuration.
     *
     * @return the new current configuration
     * @throws InvalidChoiceException if the rule does not apply right now
     */
    public Configuration apply(Transition choice) throws InvalidChoiceException {
        Configuration from = current();
        if (choice == null || !Transitions.isApplicable(choice, from)) {
            throw new InvalidChoiceException("Transition " + choice + " is not applicable to " + from);
        }
        Configuration to = Transitions.apply(from, choice);
        path.addLast(new TransitionStep(from, choice, to));
        logger.debug("Stepped {} -> {}", from, to);
        return to;
    }

    /**
     * Take the {@code index}-th (0-based) entry of {@link #applicableTransitions()}.
     */
    public Configuration apply(int index) throws InvalidChoiceException {
        List<Transition> options = applicableTransitions();
        if (index < 0 || index >= options.size()) {
            throw new InvalidChoiceException("Choice " + (index + 1) + " out of range (1.." + options.size() + ")");
        }
        return apply(options.get(index));
    }

    /**
     * Undo the last step.
     *
     * @return false when already at the start configuration
     */
    public boolean backtrack() {
        if (path.isEmpty()) {
            return false;
        }
        TransitionStep undone = path.removeLast();
        logger.debug("Backtracked over {}", undone.getTransition());
        return true;
    }

    /**
     * Configurations visited on the current path, start first.
     */
    public List<Configuration> history() {
        return trace().configurations();
    }

    public Trace trace() {
        return new Trace(start, new ArrayList<>(path));
    }

    public boolean isAccepting() {
        return mode.accepts(automaton, current());
    }

    /**
     * True when no rule applies any more (the branch is dead unless accepting).
     */
    public boolean isStuck() {
        return applicableTransitions().isEmpty();
    }
}
