package pda.automaton;

import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class AutomatonTest {

    private static Automaton.Builder oneState() {
        return Automaton.builder()
                .states("q")
                .inputAlphabet("a")
                .stackAlphabet("Z")
                .initialState("q")
                .initialStackSymbol("Z");
    }

    @Test
    public void candidatesFollowPrecedenceNotDeclarationOrder() throws Exception {
        Automaton pda = oneState()
                .transition("q", "ε", "ε", "q")
                .transition("q", "ε", "Z", "q")
                .transition("q", "a", "ε", "q")
                .transition("q", "a", "Z", "q")
                .build();

        List<Transition.Kind> kinds = new ArrayList<>();
        for (Transition t : pda.transitionsFrom("q", "a", "Z")) {
            kinds.add(t.getKind());
        }
        assertEquals(Arrays.asList(Transition.Kind.INPUT_AND_STACK, Transition.Kind.INPUT_ONLY,
                Transition.Kind.STACK_ONLY, Transition.Kind.EPSILON), kinds);
    }

    @Test
    public void declarationOrderIsKeptWithinAKind() throws Exception {
        Automaton pda = oneState()
                .states("r", "s")
                .transition("q", "a", "Z", "s")
                .transition("q", "a", "Z", "r")
                .build();

        List<Transition> candidates = pda.transitionsFrom("q", "a", "Z");
        assertEquals("s", candidates.get(0).getTo());
        assertEquals("r", candidates.get(1).getTo());
    }

    @Test
    public void exhaustedInputOnlyOffersRulesThatReadNothing() throws Exception {
        Automaton pda = oneState()
                .transition("q", "a", "Z", "q")
                .transition("q", "ε", "Z", "q")
                .build();

        List<Transition> candidates = pda.transitionsFrom("q", null, "Z");
        assertEquals(1, candidates.size());
        assertNull(candidates.get(0).getRead());
    }

    @Test
    public void emptyStackOnlyOffersRulesThatPopNothing() throws Exception {
        Automaton pda = oneState()
                .transition("q", "a", "Z", "q")
                .transition("q", "a", "ε", "q")
                .build();

        List<Transition> candidates = pda.transitionsFrom("q", "a", null);
        assertEquals(1, candidates.size());
        assertEquals(Transition.Kind.INPUT_ONLY, candidates.get(0).getKind());
    }

    @Test
    public void epsilonSpellingsAreNormalized() {
        Transition t = new Transition("q", "eps", "λ", "q", Collections.<String>emptyList());
        assertNull(t.getRead());
        assertNull(t.getPop());
        assertEquals(Transition.Kind.EPSILON, t.getKind());
        assertEquals("(ε,ε,ε)", t.label());
    }

    @Test
    public void labelJoinsPushedSymbols() {
        Transition t = new Transition("q0", "a", "Z", "q1", Arrays.asList("Z", "A"));
        assertEquals("(a,Z,ZA)", t.label());
        assertEquals("q0 -> q1 (a,Z,ZA)", t.toString());
    }

    @Test(expected = DefinitionException.class)
    public void buildRejectsUnknownStates() throws Exception {
        oneState().transition("q", "a", "Z", "nowhere").build();
    }

    @Test
    public void toBuilderRoundTripsToAnEqualDefinition() throws Exception {
        Automaton pda = oneState().finalStates("q").transition("q", "a", "Z", "q", "Z").build();
        Automaton copy = pda.toBuilder().build();
        assertEquals(pda.getStates(), copy.getStates());
        assertEquals(pda.getTransitions(), copy.getTransitions());
        assertEquals(pda.getFinalStates(), copy.getFinalStates());
    }
}
