package pda.cli;

/**
 * Ends a command early with a message and an exit status.
 */
class CommandFailedException extends Exception {

    private final ExitStatus status;

    CommandFailedException(ExitStatus status, String message) {
        super(message);
        this.status = status;
    }

    CommandFailedException(ExitStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    ExitStatus getStatus() {
        return status;
    }
}
