package pda.cli;

import org.aesh.command.AeshCommandRuntimeBuilder;
import org.aesh.command.CommandNotFoundException;
import org.aesh.command.CommandResult;
import org.aesh.command.CommandRuntime;
import org.aesh.command.impl.registry.AeshCommandRegistryBuilder;
import org.aesh.command.invocation.CommandInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Entry point: {@code pda-sim <run|step|draw|validate> [options]}.
 *
 * Exit status: 0 accepted (or valid), 1 rejected, 2 inconclusive, 3 invalid definition,
 * 4 load or usage error.
 */
public class PdaSimMain {

    private static final Logger logger = LoggerFactory.getLogger(PdaSimMain.class);

    static final String USAGE = "Usage: pda-sim <run|step|draw|validate> --file <definition> [options]\n"
            + "  run      --file F [--input S] [--acceptance final_state|empty_stack|both] [--step-limit N] [--mode auto|frontier] [--json]\n"
            + "  step     --file F [--input S] [--acceptance final_state|empty_stack|both]\n"
            + "  draw     --file F [--format ascii|dot]\n"
            + "  validate --file F";

    public static void main(String[] args) {
        System.exit(new PdaSimMain().execute(args));
    }

    /**
     * Run one command line and return its exit status.
     */
    public int execute(String... args) {
        if (args.length == 0) {
            System.out.println(USAGE);
            return ExitStatus.LOAD_ERROR.code();
        }
        CommandResult result;
        try {
            @SuppressWarnings("unchecked")
            AeshCommandRegistryBuilder<CommandInvocation> registry = AeshCommandRegistryBuilder.<CommandInvocation>builder()
                    .commands(RunCommand.class, StepCommand.class, DrawCommand.class, ValidateCommand.class);
            CommandRuntime<CommandInvocation> runtime = AeshCommandRuntimeBuilder.<CommandInvocation>builder()
                    .commandRegistry(registry.create())
                    .build();
            result = runtime.executeCommand(commandLine(args));
        } catch (CommandNotFoundException e) {
            System.out.println("Unknown command: " + args[0]);
            System.out.println(USAGE);
            return ExitStatus.LOAD_ERROR.code();
        } catch (Exception e) {
            logger.debug("Command line {} failed", Arrays.toString(args), e);
            System.out.println("Usage error: " + e.getMessage());
            System.out.println(USAGE);
            return ExitStatus.LOAD_ERROR.code();
        }
        return result == null ? ExitStatus.LOAD_ERROR.code() : result.getResultValue();
    }

    /**
     * Join arguments into one line for the aesh parser. An empty argument becomes "ε", which the
     * commands read as the empty input.
     */
    static String commandLine(String... args) {
        return Arrays.stream(args)
                .map(arg -> arg.isEmpty() ? "ε" : arg.replaceAll("([\\\\ \"'])", "\\\\$1"))
                .collect(Collectors.joining(" "));
    }
}
