package pda.cli;

import org.aesh.command.CommandDefinition;
import org.aesh.command.invocation.CommandInvocation;
import org.aesh.command.option.Option;
import pda.automaton.Automaton;
import pda.render.AsciiRenderer;
import pda.render.DotRenderer;

import java.util.Locale;

@CommandDefinition(name = "draw", description = "Draws the automaton as ASCII art or Graphviz DOT")
public class DrawCommand extends BaseCommand {

    @Option(shortName = 'o', name = "format", description = "ascii or dot", defaultValue = "ascii")
    String format;

    @Override
    protected ExitStatus run(CommandInvocation invocation) throws CommandFailedException {
        String f = format == null ? "ascii" : format.trim().toLowerCase(Locale.ROOT);
        if (!f.equals("ascii") && !f.equals("dot")) {
            throw new CommandFailedException(ExitStatus.LOAD_ERROR, "Usage error: unknown format '" + format + "' (expected ascii or dot)");
        }
        Automaton automaton = loadAutomaton();
        invocation.println(f.equals("dot") ? DotRenderer.render(automaton) : AsciiRenderer.render(automaton));
        return ExitStatus.OK;
    }
}
