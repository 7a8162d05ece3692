package pda.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.aesh.command.CommandDefinition;
import org.aesh.command.invocation.CommandInvocation;
import org.aesh.command.option.Option;
import pda.api.SimulationReport;
import pda.automaton.Automaton;
import pda.render.StepView;
import pda.simulation.Configuration;
import pda.simulation.SimulationEngine;
import pda.simulation.SimulationOptions;
import pda.simulation.SimulationResult;

import java.util.List;
import java.util.Locale;

@CommandDefinition(name = "run", description = "Decides whether the automaton accepts an input string")
public class RunCommand extends BaseCommand {

    @Option(shortName = 'i', description = "Input string; omit or pass ε for the empty input")
    String input;

    @Option(shortName = 'a', description = "final_state, empty_stack or both", defaultValue = "final_state")
    String acceptance;

    @Option(name = "step-limit", shortName = 'l', description = "Maximum number of configuration expansions (unbounded by default)")
    Integer stepLimit;

    @Option(shortName = 'm', description = "auto prints the result, frontier also prints every search layer", defaultValue = "auto")
    String mode;

    @Option(hasValue = false, description = "Print the result as JSON")
    boolean json;

    private final SimulationEngine engine = new SimulationEngine();

    @Override
    protected ExitStatus run(CommandInvocation invocation) throws CommandFailedException {
        String displayMode = mode == null ? "auto" : mode.trim().toLowerCase(Locale.ROOT);
        if (!displayMode.equals("auto") && !displayMode.equals("frontier")) {
            throw new CommandFailedException(ExitStatus.LOAD_ERROR, "Usage error: unknown mode '" + mode + "' (expected auto or frontier)");
        }
        SimulationOptions options = options();
        Automaton automaton = loadAutomaton();
        String text = inputText(input);

        if (displayMode.equals("frontier") && !json) {
            List<List<Configuration>> layers = engine.frontiers(automaton, text, options);
            for (int depth = 0; depth < layers.size(); depth++) {
                invocation.println("Depth " + depth + ":");
                invocation.println(StepView.renderFrontier(layers.get(depth)));
            }
        }

        SimulationResult result = engine.run(automaton, text, options);
        if (json) {
            try {
                invocation.println(SimulationReport.from(result).toJson());
            } catch (JsonProcessingException ex) {
                throw new IllegalStateException("Cannot serialize report", ex);
            }
        } else {
            invocation.println(StepView.renderResult(result));
        }
        return ExitStatus.of(result);
    }

    private SimulationOptions options() throws CommandFailedException {
        try {
            return SimulationOptions.of(parseMode(acceptance), stepLimit);
        } catch (IllegalArgumentException ex) {
            throw new CommandFailedException(ExitStatus.LOAD_ERROR, "Usage error: " + ex.getMessage(), ex);
        }
    }
}
