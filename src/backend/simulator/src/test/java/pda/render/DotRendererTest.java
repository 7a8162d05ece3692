package pda.render;

import org.junit.Test;
import pda.SampleAutomata;

import static org.junit.Assert.*;

public class DotRendererTest {

    @Test
    public void rendersStatesAndGroupedEdges() throws Exception {
        String dot = DotRenderer.render(SampleAutomata.anbn());

        assertTrue(dot.startsWith("digraph \"pda\" {\n"));
        assertTrue(dot.contains("\"q0\" [shape = circle];"));
        assertTrue(dot.contains("\"q2\" [shape = doublecircle];"));
        assertTrue(dot.contains("\"__start\" -> \"q0\""));
        assertTrue(dot.contains("\"q0\" -> \"q0\" [label = \"(a,Z,ZA)\\n(a,A,AA)\"];"));
        assertTrue(dot.contains("\"q1\" -> \"q2\" [label = \"(ε,Z,Z)\"];"));
        assertTrue(dot.trim().endsWith("}"));
    }

    @Test
    public void idsAreEscaped() {
        assertEquals("\"say \\\"hi\\\"\"", DotRenderer.escapeId("say \"hi\""));
    }
}
