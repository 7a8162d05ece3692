package pda.cli;

import org.aesh.command.CommandDefinition;
import org.aesh.command.invocation.CommandInvocation;
import org.aesh.command.option.Option;
import pda.automaton.Automaton;
import pda.interactive.StepConsole;
import pda.interactive.StepSession;
import pda.simulation.SimulationEnums.AcceptanceMode;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

@CommandDefinition(name = "step", description = "Walks the automaton interactively, choosing one transition at a time")
public class StepCommand extends BaseCommand {

    @Option(shortName = 'i', description = "Input string; omit or pass ε for the empty input")
    String input;

    @Option(shortName = 'a', description = "final_state, empty_stack or both", defaultValue = "final_state")
    String acceptance;

    @Override
    protected ExitStatus run(CommandInvocation invocation) throws CommandFailedException {
        AcceptanceMode acceptanceMode = parseMode(acceptance);
        Automaton automaton = loadAutomaton();
        StepSession session = new StepSession(automaton, inputText(input), acceptanceMode);

        // not closed: System.in belongs to the process
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            boolean accepted = new StepConsole(session, in, invocation::println).run();
            return accepted ? ExitStatus.ACCEPTED : ExitStatus.REJECTED;
        } catch (IOException ex) {
            throw new CommandFailedException(ExitStatus.LOAD_ERROR, "Error: cannot read from the terminal: " + ex.getMessage(), ex);
        }
    }
}
