package pda.interactive;

/**
 * The caller picked a transition that does not apply to the current configuration.
 * The session is left untouched, so the caller can simply choose again.
 */
public class InvalidChoiceException extends Exception {

    public InvalidChoiceException(String message) {
        super(message);
    }
}
