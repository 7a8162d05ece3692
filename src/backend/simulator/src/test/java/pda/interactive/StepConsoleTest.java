package pda.interactive;

import org.junit.Test;
import pda.SampleAutomata;
import pda.render.StepView;
import pda.simulation.SimulationEnums.AcceptanceMode;

import java.io.BufferedReader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class StepConsoleTest {

    private final List<String> output = new ArrayList<>();

    private boolean run(String typed) throws Exception {
        StepSession session = new StepSession(SampleAutomata.parens(), "()", AcceptanceMode.EMPTY_STACK);
        return new StepConsole(session, new BufferedReader(new StringReader(typed)), output::add).run();
    }

    @Test
    public void choosingTheRightPathAccepts() throws Exception {
        assertTrue(run("1\n1\n1\n"));
        assertTrue(output.contains("** accepting configuration **"));
        assertEquals("Session ended on an accepting configuration.", output.get(output.size() - 1));
    }

    @Test
    public void quittingEarlyEndsWithoutAcceptance() throws Exception {
        assertFalse(run("1\nq\n1\n"));
        assertEquals("Session ended without acceptance.", output.get(output.size() - 1));
    }

    @Test
    public void invalidChoiceAsksAgain() throws Exception {
        run("9\n");
        assertTrue(output.contains("Choice 9 out of range (1..2), choose again."));
    }

    @Test
    public void backtrackAtStartIsReported() throws Exception {
        run("b\n");
        assertTrue(output.contains("Already at the start configuration."));
    }

    @Test
    public void unknownCommandIsReported() throws Exception {
        run("jump\n");
        assertTrue(output.contains("Unknown command 'jump'."));
    }

    @Test
    public void traceCommandPrintsThePath() throws Exception {
        run("1\nt\n");
        boolean printed = false;
        for (String line : output) {
            if (line.contains("1. q -> q ((,Z,Z()")) printed = true;
        }
        assertTrue(printed);
    }

    @Test
    public void everyPromptStartsWithASeparator() throws Exception {
        run("1\n");
        assertEquals(StepView.RULE, output.get(1));
        assertTrue(Collections.frequency(output, StepView.RULE) >= 2);
    }
}
