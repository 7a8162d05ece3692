package pda.simulation;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class ConfigurationTest {

    @Test
    public void laterChangesToTheCallersInputDoNotLeakIn() {
        List<String> input = new ArrayList<>(Arrays.asList("a", "b"));
        Configuration config = new Configuration("q0", input, SymbolStack.of("Z"));
        Set<Configuration> visited = new HashSet<>();
        visited.add(config);

        input.set(0, "b");
        input.add("c");

        assertEquals(Arrays.asList("a", "b"), config.getRemainingInput());
        assertTrue(visited.contains(new Configuration("q0", Arrays.asList("a", "b"), SymbolStack.of("Z"))));
    }

    @Test
    public void remainingInputCannotBeModified() {
        Configuration config = new Configuration("q0", Arrays.asList("a"), SymbolStack.of("Z"));
        try {
            config.getRemainingInput().set(0, "b");
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException expected) {
            assertEquals("a", config.nextInputSymbol());
        }
    }

    @Test
    public void equalityIgnoresHowMuchInputWasConsumed() {
        Configuration fresh = new Configuration("q1", Arrays.asList("b"), SymbolStack.of("Z", "A"));
        Configuration stepped = new Configuration("q1", Arrays.asList("a", "b"), SymbolStack.of("Z", "A"))
                .next("q1", true, SymbolStack.of("Z", "A"));

        assertEquals(1, stepped.getConsumed());
        assertEquals(fresh, stepped);
        assertEquals(fresh.hashCode(), stepped.hashCode());
    }
}
