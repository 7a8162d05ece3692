package pda.simulation;

import org.junit.Test;

import java.util.Arrays;
import java.util.NoSuchElementException;

import static org.junit.Assert.*;

public class SymbolStackTest {

    @Test
    public void lastPushedSymbolEndsOnTop() {
        SymbolStack stack = SymbolStack.of("Z").push(Arrays.asList("A", "B"));
        assertEquals("B", stack.peek());
        assertEquals(3, stack.size());
        assertEquals(Arrays.asList("Z", "A", "B"), stack.toList());
    }

    @Test
    public void pushAndPopLeaveTheOriginalUntouched() {
        SymbolStack base = SymbolStack.of("Z", "A");
        SymbolStack pushed = base.push("B");
        SymbolStack popped = base.pop();

        assertEquals(Arrays.asList("Z", "A"), base.toList());
        assertEquals("B", pushed.peek());
        assertEquals("Z", popped.peek());
    }

    @Test
    public void stacksWithTheSameContentAreEqual() {
        SymbolStack a = SymbolStack.empty().push("Z").push("A");
        SymbolStack b = SymbolStack.of("Z", "A", "B").pop();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, SymbolStack.of("A", "Z"));
    }

    @Test
    public void emptyStackHasNoTop() {
        assertNull(SymbolStack.empty().peek());
        assertTrue(SymbolStack.of("Z").pop().isEmpty());
        assertEquals("ε", SymbolStack.empty().toString());
    }

    @Test(expected = NoSuchElementException.class)
    public void poppingAnEmptyStackFails() {
        SymbolStack.empty().pop();
    }
}
