package pda.validation;

import org.junit.Test;
import pda.automaton.Automaton;
import pda.automaton.DefinitionException;

import java.util.List;

import static org.junit.Assert.*;

public class DefinitionValidatorTest {

    private static Automaton.Builder valid() {
        return Automaton.builder()
                .states("q0", "q1")
                .inputAlphabet("a")
                .stackAlphabet("Z")
                .initialState("q0")
                .initialStackSymbol("Z")
                .finalStates("q1")
                .transition("q0", "a", "Z", "q1", "Z");
    }

    @Test
    public void validDefinitionHasNoViolations() {
        assertTrue(DefinitionValidator.validate(valid()).isEmpty());
    }

    @Test
    public void unknownTargetStateIsReportedExactlyOnce() {
        Automaton.Builder candidate = valid().transition("q1", "a", "Z", "q9", "Z");

        List<Violation> violations = DefinitionValidator.validate(candidate);
        assertEquals(1, violations.size());
        assertEquals(Violation.Kind.UNKNOWN_STATE, violations.get(0).getKind());
        assertEquals("q9", violations.get(0).getSubject());
        assertTrue(violations.get(0).getMessage().contains("q9"));
    }

    @Test
    public void buildFailsWithTheSameViolations() {
        Automaton.Builder candidate = valid().transition("q1", "a", "Z", "q9", "Z");
        try {
            candidate.build();
            fail("expected DefinitionException");
        } catch (DefinitionException ex) {
            assertEquals(DefinitionValidator.validate(candidate), ex.getViolations());
            assertTrue(ex.getMessage().contains("q9"));
        }
    }

    @Test
    public void unreachableFinalStateIsNotAViolation() {
        Automaton.Builder candidate = valid().states("orphan").finalStates("orphan");
        assertTrue(DefinitionValidator.validate(candidate).isEmpty());
    }

    @Test
    public void everyProblemIsCollected() {
        Automaton.Builder candidate = Automaton.builder()
                .states("q0", "q0")
                .inputAlphabet("a", "ε")
                .stackAlphabet("Z")
                .finalStates("qf")
                .transition("q0", "b", "Y", "q0", "X");

        List<Violation> violations = DefinitionValidator.validate(candidate);
        assertTrue(hasKind(violations, Violation.Kind.DUPLICATE_STATE));
        assertTrue(hasKind(violations, Violation.Kind.RESERVED_SYMBOL));
        assertTrue(hasKind(violations, Violation.Kind.MISSING_INITIAL_STATE));
        assertTrue(hasKind(violations, Violation.Kind.MISSING_INITIAL_STACK_SYMBOL));
        assertTrue(hasKind(violations, Violation.Kind.UNKNOWN_STATE));
        // read b, pop Y, push X
        assertEquals(3, count(violations, Violation.Kind.UNKNOWN_SYMBOL));
    }

    @Test
    public void duplicateStateIsReportedOncePerName() {
        Automaton.Builder candidate = valid().states("q0", "q0");
        assertEquals(1, count(DefinitionValidator.validate(candidate), Violation.Kind.DUPLICATE_STATE));
    }

    @Test
    public void emptyStateSetIsReported() {
        List<Violation> violations = DefinitionValidator.validate(Automaton.builder());
        assertTrue(hasKind(violations, Violation.Kind.EMPTY_STATES));
    }

    @Test
    public void initialStackSymbolMustBeDeclared() {
        Automaton.Builder candidate = valid().initialStackSymbol("Y");
        List<Violation> violations = DefinitionValidator.validate(candidate);
        assertEquals(1, violations.size());
        assertEquals(Violation.Kind.UNKNOWN_SYMBOL, violations.get(0).getKind());
        assertEquals("Y", violations.get(0).getSubject());
    }

    private static boolean hasKind(List<Violation> violations, Violation.Kind kind) {
        return count(violations, kind) > 0;
    }

    private static int count(List<Violation> violations, Violation.Kind kind) {
        int n = 0;
        for (Violation v : violations) {
            if (v.getKind() == kind) n++;
        }
        return n;
    }
}
