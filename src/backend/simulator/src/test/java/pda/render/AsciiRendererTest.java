package pda.render;

import org.junit.Test;
import pda.SampleAutomata;

import java.util.Arrays;

import static org.junit.Assert.*;

public class AsciiRendererTest {

    @Test
    public void headerListsStatesInitialAndFinals() throws Exception {
        String drawing = AsciiRenderer.render(SampleAutomata.anbn());

        assertTrue(drawing.startsWith("== Automaton ==\n"));
        assertTrue(drawing.contains("States: q0, q1, q2\n"));
        assertTrue(drawing.contains("Initial: q0"));
        assertTrue(drawing.contains("Final: q2"));
    }

    @Test
    public void finalStatesAreDoubleRinged() throws Exception {
        String drawing = AsciiRenderer.render(SampleAutomata.anbn());

        assertTrue(drawing.contains("((  q2  ))"));
        assertTrue(drawing.contains("(  q0  )"));
        assertFalse(drawing.contains("((  q0  ))"));
    }

    @Test
    public void selfLoopsSitAboveTheirStateAndArrowsBelow() throws Exception {
        String drawing = AsciiRenderer.render(SampleAutomata.anbn());
        String[] lines = drawing.split("\n");

        int loopLine = indexOf(lines, "@ (a,Z,ZA) | (a,A,AA)");
        int boxLine = indexOf(lines, "(  q0  )");
        int arrowLine = indexOf(lines, "> (b,A,ε)");
        assertTrue(loopLine >= 0 && boxLine >= 0 && arrowLine >= 0);
        assertTrue(loopLine < boxLine);
        assertTrue(boxLine < arrowLine);
        assertTrue(drawing.contains("(ε,Z,Z)"));
    }

    @Test
    public void rulesSharingAnEdgeShareALabel() throws Exception {
        String drawing = AsciiRenderer.render(SampleAutomata.parens());
        assertTrue(drawing.contains("@ ((,Z,Z() | ((,(,(() | (),(,ε) | (ε,Z,ε)"));
    }

    @Test
    public void statesAreSortedNaturally() {
        assertEquals(Arrays.asList("q1", "q2", "q10", "start"),
                AsciiRenderer.sortedStates(Arrays.asList("q10", "start", "q2", "q1")));
    }

    private static int indexOf(String[] lines, String needle) {
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].contains(needle)) return i;
        }
        return -1;
    }
}
