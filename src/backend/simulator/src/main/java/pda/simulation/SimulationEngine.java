package pda.simulation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pda.automaton.Automaton;
import pda.automaton.Transition;
import pda.simulation.SimulationEnums.AcceptanceMode;
import pda.simulation.SimulationEnums.EngineState;

import java.util.*;

/**
 * Nondeterministic PDA simulation by breadth-first search over configurations.
 *
 * From a configuration every applicable rule is a branch; branches are independent
 * {@link Configuration} values in a FIFO queue. A configuration is enqueued at most once per
 * run (visited set), which is what makes pure epsilon cycles terminate. An optional step limit
 * bounds the number of expansions for rule sets that grow the stack forever without repeating.
 *
 * The engine keeps no state between runs: queue, visited set and parent links belong to one
 * {@link #run} call, so one engine (and one immutable {@link Automaton}) can serve concurrent runs.
 *
 * Usage:
 *   SimulationEngine engine = new SimulationEngine();
 *   SimulationResult result = engine.run(pda, "(())", SimulationOptions.of(AcceptanceMode.EMPTY_STACK));
 *   if (result.isAccepted()) render(result.getTrace());
 */
public class SimulationEngine {

    private static final Logger logger = LoggerFactory.getLogger(SimulationEngine.class);

    public SimulationResult run(Automaton automaton, String input, SimulationOptions options) {
        return run(automaton, InputTokenizer.tokenize(input, automaton), options);
    }

    public SimulationResult run(Automaton automaton, List<String> input, SimulationOptions options) {
        Objects.requireNonNull(automaton, "automaton");
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(options, "options");
        return new Search(automaton, input, options).execute();
    }

    /**
     * Layer-by-layer view of the same search, for step-by-step rendering.
     *
     * Element 0 is the start frontier; element i+1 holds the not-yet-seen successors of element i,
     * in expansion order. Stops when a layer comes out empty or, with a step limit, once that many
     * layers have been expanded.
     */
    public List<List<Configuration>> frontiers(Automaton automaton, String input, SimulationOptions options) {
        List<String> symbols = InputTokenizer.tokenize(input, automaton);
        Configuration start = Configuration.initial(automaton, symbols);

        List<List<Configuration>> layers = new ArrayList<>();
        Set<Configuration> seen = new HashSet<>();
        List<Configuration> frontier = Collections.singletonList(start);
        seen.add(start);

        int expanded = 0;
        while (!frontier.isEmpty()) {
            layers.add(frontier);
            if (options.hasStepLimit() && expanded >= options.getStepLimit()) {
                logger.info("Frontier exploration stopped after {} layers (step limit)", expanded);
                break;
            }
            List<Configuration> next = new ArrayList<>();
            for (Configuration config : frontier) {
                for (Transition t : Transitions.applicable(automaton, config)) {
                    Configuration successor = Transitions.apply(config, t);
                    if (seen.add(successor)) {
                        next.add(successor);
                    }
                }
            }
            expanded++;
            frontier = next;
        }
        return layers;
    }

    /**
     * Working state of one run.
     */
    private static final class Search {
        private final Automaton automaton;
        private final SimulationOptions options;
        private final AcceptanceMode mode;
        private final Configuration start;

        private final Queue<Configuration> queue = new ArrayDeque<>();
        private final Set<Configuration> visited = new HashSet<>();
        private final Map<Configuration, TransitionStep> parent = new HashMap<>();

        private EngineState state = EngineState.READY;
        private int expansions;

        Search(Automaton automaton, List<String> input, SimulationOptions options) {
            this.automaton = automaton;
            this.options = options;
            this.mode = options.getAcceptanceMode();
            this.start = Configuration.initial(automaton, input);
        }

        SimulationResult execute() {
            state = EngineState.SEARCHING;
            logger.debug("Searching from {} with {}", start, options);

            queue.add(start);
            visited.add(start);

            while (!queue.isEmpty()) {
                Configuration current = queue.poll();

                if (mode.accepts(automaton, current)) {
                    Trace trace = reconstruct(current);
                    return finish(EngineState.ACCEPTED, SimulationResult.accepted(trace, options, expansions, visited.size()));
                }

                if (options.hasStepLimit() && expansions >= options.getStepLimit()) {
                    logger.info("Step limit {} reached with {} configurations still queued",
                            options.getStepLimit(), queue.size() + 1);
                    return finish(EngineState.INCONCLUSIVE, SimulationResult.inconclusive(options, expansions, visited.size()));
                }

                expand(current);
            }

            return finish(EngineState.REJECTED, SimulationResult.rejected(options, expansions, visited.size()));
        }

        private SimulationResult finish(EngineState terminal, SimulationResult result) {
            logger.debug("{} -> {}: {}", state, terminal, result);
            state = terminal;
            return result;
        }

        private void expand(Configuration current) {
            expansions++;
            for (Transition t : Transitions.applicable(automaton, current)) {
                Configuration next = Transitions.apply(current, t);
                // re-derived configurations are dropped without re-expansion
                if (visited.add(next)) {
                    parent.put(next, new TransitionStep(current, t, next));
                    queue.add(next);
                }
            }
        }

        private Trace reconstruct(Configuration accepting) {
            LinkedList<TransitionStep> steps = new LinkedList<>();
            Configuration c = accepting;
            TransitionStep step;
            while ((step = parent.get(c)) != null) {
                steps.addFirst(step);
                c = step.getSource();
            }
            return new Trace(start, steps);
        }
    }
}
