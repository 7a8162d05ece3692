package pda.cli;

import org.aesh.command.Command;
import org.aesh.command.CommandDefinition;
import org.aesh.command.CommandResult;
import org.aesh.command.invocation.CommandInvocation;
import org.aesh.command.option.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pda.automaton.Automaton;
import pda.automaton.DefinitionException;
import pda.automaton.Symbols;
import pda.loader.AutomatonLoader;
import pda.loader.LoadException;
import pda.simulation.SimulationEnums.AcceptanceMode;
import pda.validation.Violation;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Options and plumbing shared by every command: the definition file, help, loading and the
 * mapping of failures to exit codes.
 */
public abstract class BaseCommand implements Command<CommandInvocation> {

    private static final Logger logger = LoggerFactory.getLogger(BaseCommand.class);

    @Option(shortName = 'f', name = "file", required = true, description = "Automaton definition (.yaml, .json, .txt/.pda, .csv)")
    protected String file;

    @Option(shortName = 'h', hasValue = false, overrideRequired = true, description = "Show this help")
    protected boolean help;

    protected final AutomatonLoader loader = new AutomatonLoader();

    @Override
    public CommandResult execute(CommandInvocation invocation) {
        if (help) {
            invocation.println(invocation.getHelpInfo(commandName()));
            return ExitStatus.OK.toCommandResult();
        }
        try {
            return run(invocation).toCommandResult();
        } catch (CommandFailedException ex) {
            logger.debug("{} failed with {}", commandName(), ex.getStatus(), ex);
            invocation.println(ex.getMessage());
            return ex.getStatus().toCommandResult();
        }
    }

    protected abstract ExitStatus run(CommandInvocation invocation) throws CommandFailedException;

    protected Path definitionPath() {
        return Paths.get(file);
    }

    /**
     * Load and validate the definition file, translating failures into exit statuses.
     */
    protected Automaton loadAutomaton() throws CommandFailedException {
        try {
            return loader.load(definitionPath());
        } catch (LoadException ex) {
            throw new CommandFailedException(ExitStatus.LOAD_ERROR, "Error: " + ex.getMessage(), ex);
        } catch (DefinitionException ex) {
            StringBuilder sb = new StringBuilder("Error: invalid automaton definition in ").append(file);
            for (Violation v : ex.getViolations()) {
                sb.append("\n  - ").append(v.getMessage());
            }
            throw new CommandFailedException(ExitStatus.DEFINITION_ERROR, sb.toString(), ex);
        }
    }

    protected static AcceptanceMode parseMode(String value) throws CommandFailedException {
        try {
            return AcceptanceMode.parse(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandFailedException(ExitStatus.LOAD_ERROR, "Usage error: " + ex.getMessage(), ex);
        }
    }

    /**
     * The raw input text; absent or any epsilon spelling ({@code --input ε}) is the empty input.
     */
    protected static String inputText(String input) {
        return Symbols.isEpsilon(input) ? "" : input;
    }

    private String commandName() {
        CommandDefinition definition = getClass().getAnnotation(CommandDefinition.class);
        return definition == null ? getClass().getSimpleName() : definition.name();
    }
}
