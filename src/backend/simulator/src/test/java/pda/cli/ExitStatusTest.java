package pda.cli;

import org.junit.Test;
import pda.SampleAutomata;
import pda.simulation.SimulationEngine;
import pda.simulation.SimulationEnums.AcceptanceMode;
import pda.simulation.SimulationOptions;

import static org.junit.Assert.*;

public class ExitStatusTest {

    private final SimulationEngine engine = new SimulationEngine();

    @Test
    public void codesAreStable() {
        assertEquals(0, ExitStatus.ACCEPTED.code());
        assertEquals(0, ExitStatus.OK.code());
        assertEquals(1, ExitStatus.REJECTED.code());
        assertEquals(2, ExitStatus.INCONCLUSIVE.code());
        assertEquals(3, ExitStatus.DEFINITION_ERROR.code());
        assertEquals(4, ExitStatus.LOAD_ERROR.code());
    }

    @Test
    public void outcomesMapToStatuses() throws Exception {
        SimulationOptions emptyStack = SimulationOptions.of(AcceptanceMode.EMPTY_STACK);
        assertEquals(ExitStatus.ACCEPTED, ExitStatus.of(engine.run(SampleAutomata.parens(), "()", emptyStack)));
        assertEquals(ExitStatus.REJECTED, ExitStatus.of(engine.run(SampleAutomata.parens(), ")(", emptyStack)));
        assertEquals(ExitStatus.INCONCLUSIVE, ExitStatus.of(engine.run(SampleAutomata.unboundedPush(), "",
                SimulationOptions.of(AcceptanceMode.FINAL_STATE, 3))));
    }

    @Test
    public void commandResultCarriesTheCode() {
        assertEquals(3, ExitStatus.DEFINITION_ERROR.toCommandResult().getResultValue());
    }
}
