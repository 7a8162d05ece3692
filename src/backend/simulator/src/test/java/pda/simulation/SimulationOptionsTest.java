package pda.simulation;

import org.junit.Test;
import pda.simulation.SimulationEnums.AcceptanceMode;

import static org.junit.Assert.*;

public class SimulationOptionsTest {

    @Test
    public void defaultsAreFinalStateWithoutLimit() {
        SimulationOptions options = SimulationOptions.defaults();
        assertEquals(AcceptanceMode.FINAL_STATE, options.getAcceptanceMode());
        assertFalse(options.hasStepLimit());
        assertNull(options.getStepLimit());
    }

    @Test
    public void withersReturnNewOptions() {
        SimulationOptions base = SimulationOptions.defaults();
        SimulationOptions limited = base.withStepLimit(50).withAcceptanceMode(AcceptanceMode.BOTH);

        assertFalse(base.hasStepLimit());
        assertEquals(Integer.valueOf(50), limited.getStepLimit());
        assertEquals(AcceptanceMode.BOTH, limited.getAcceptanceMode());
        assertEquals(SimulationOptions.of(AcceptanceMode.BOTH, 50), limited);
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroStepLimitIsRejected() {
        SimulationOptions.of(AcceptanceMode.FINAL_STATE, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeStepLimitIsRejected() {
        SimulationOptions.defaults().withStepLimit(-3);
    }

    @Test
    public void modeNamesParseLeniently() {
        assertEquals(AcceptanceMode.FINAL_STATE, AcceptanceMode.parse("final_state"));
        assertEquals(AcceptanceMode.FINAL_STATE, AcceptanceMode.parse("Final-State"));
        assertEquals(AcceptanceMode.EMPTY_STACK, AcceptanceMode.parse(" EMPTY_STACK "));
        assertEquals(AcceptanceMode.BOTH, AcceptanceMode.parse("both"));
        assertEquals("empty_stack", AcceptanceMode.EMPTY_STACK.externalName());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownModeNameIsRejected() {
        AcceptanceMode.parse("accept_all");
    }
}
