package pda.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.aesh.command.CommandDefinition;
import org.aesh.command.invocation.CommandInvocation;
import org.aesh.command.option.Option;
import pda.api.ValidationReport;
import pda.automaton.Automaton;
import pda.loader.LoadException;
import pda.validation.Violation;

import java.util.List;

@CommandDefinition(name = "validate", description = "Checks a definition file and lists every problem found")
public class ValidateCommand extends BaseCommand {

    @Option(hasValue = false, description = "Print the findings as JSON")
    boolean json;

    @Override
    protected ExitStatus run(CommandInvocation invocation) throws CommandFailedException {
        Automaton.Builder candidate;
        try {
            candidate = loader.read(definitionPath());
        } catch (LoadException ex) {
            throw new CommandFailedException(ExitStatus.LOAD_ERROR, "Error: " + ex.getMessage(), ex);
        }

        List<Violation> violations = candidate.validate();
        if (json) {
            try {
                invocation.println(ValidationReport.from(file, candidate, violations).toJson());
            } catch (JsonProcessingException ex) {
                throw new IllegalStateException("Cannot serialize report", ex);
            }
            return violations.isEmpty() ? ExitStatus.OK : ExitStatus.DEFINITION_ERROR;
        }
        if (violations.isEmpty()) {
            invocation.println("Valid: " + file + " (" + candidate.getStates().size() + " states, "
                    + candidate.getTransitions().size() + " transitions)");
            return ExitStatus.OK;
        }
        invocation.println("Invalid: " + file + " (" + violations.size()
                + (violations.size() == 1 ? " problem)" : " problems)"));
        for (Violation v : violations) {
            invocation.println("  - [" + v.getKind() + "] " + v.getMessage());
        }
        return ExitStatus.DEFINITION_ERROR;
    }
}
