package pda.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One structural problem found in a candidate definition.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Violation {

    public enum Kind {
        EMPTY_STATES,
        DUPLICATE_STATE,
        MISSING_INITIAL_STATE,
        MISSING_INITIAL_STACK_SYMBOL,
        UNKNOWN_STATE,
        UNKNOWN_SYMBOL,
        RESERVED_SYMBOL
    }

    @JsonProperty("kind")
    private final Kind kind;

    @JsonProperty("subject") // offending state or symbol name, if any
    private final String subject;

    @JsonProperty("message")
    private final String message;

    public Violation(Kind kind, String subject, String message) {
        this.kind = kind;
        this.subject = subject;
        this.message = message;
    }

    public Kind getKind() { return kind; }
    public String getSubject() { return subject; }
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Violation)) return false;
        Violation that = (Violation) o;
        return kind == that.kind && Objects.equals(subject, that.subject) && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, subject, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
