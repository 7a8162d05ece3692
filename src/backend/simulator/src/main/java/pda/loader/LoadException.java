package pda.loader;

/**
 * A definition file could not be read or parsed.
 *
 * Structural problems of a syntactically valid file (unknown states, missing initial state, ...)
 * are not reported here; they surface as violations of the candidate definition.
 */
public class LoadException extends Exception {

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
