package pda.cli;

import org.aesh.command.CommandResult;
import pda.simulation.SimulationResult;

/**
 * Process exit codes of the command line.
 */
public enum ExitStatus {
    ACCEPTED(0),
    REJECTED(1),
    INCONCLUSIVE(2),
    DEFINITION_ERROR(3),
    LOAD_ERROR(4);

    /** {@code validate} and {@code draw} success share the accepted code. */
    public static final ExitStatus OK = ACCEPTED;

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public CommandResult toCommandResult() {
        return CommandResult.valueOf(code);
    }

    public static ExitStatus of(SimulationResult result) {
        switch (result.getOutcome()) {
            case ACCEPTED:
                return ACCEPTED;
            case REJECTED:
                return REJECTED;
            default:
                return INCONCLUSIVE;
        }
    }
}
