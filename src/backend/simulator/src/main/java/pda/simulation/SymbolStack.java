package pda.simulation;

import java.util.*;

/**
 * Persistent (immutable, structurally shared) LIFO stack of symbols.
 *
 * Every operation returns a new stack, so sibling branches of the search can share their
 * common bottom part without ever aliasing mutable state.
 */
public final class SymbolStack {

    private static final SymbolStack EMPTY = new SymbolStack(null, null, 0);

    private final String top;
    private final SymbolStack below;
    private final int size;
    private int hash;

    private SymbolStack(String top, SymbolStack below, int size) {
        this.top = top;
        this.below = below;
        this.size = size;
    }

    public static SymbolStack empty() {
        return EMPTY;
    }

    /**
     * Build a stack from bottom-to-top ordered symbols.
     */
    public static SymbolStack of(List<String> bottomToTop) {
        return EMPTY.push(bottomToTop);
    }

    public static SymbolStack of(String... bottomToTop) {
        return of(Arrays.asList(bottomToTop));
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    /**
     * @return the top symbol, or {@code null} when the stack is empty
     */
    public String peek() {
        return top;
    }

    public SymbolStack pop() {
        if (isEmpty()) {
            throw new NoSuchElementException("pop from empty stack");
        }
        return below;
    }

    public SymbolStack push(String symbol) {
        return new SymbolStack(Objects.requireNonNull(symbol, "symbol"), this, size + 1);
    }

    /**
     * Push a sequence left to right; its last element ends up on top.
     */
    public SymbolStack push(List<String> symbols) {
        SymbolStack s = this;
        for (String symbol : symbols) {
            s = s.push(symbol);
        }
        return s;
    }

    /**
     * @return symbols ordered bottom to top
     */
    public List<String> toList() {
        String[] out = new String[size];
        SymbolStack s = this;
        for (int i = size - 1; i >= 0; i--) {
            out[i] = s.top;
            s = s.below;
        }
        return Arrays.asList(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolStack)) return false;
        SymbolStack a = this;
        SymbolStack b = (SymbolStack) o;
        if (a.size != b.size || a.hashCode() != b.hashCode()) return false;
        while (a != b && a.size > 0) {
            if (!a.top.equals(b.top)) return false;
            a = a.below;
            b = b.below;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0 && size > 0) {
            h = 31 * below.hashCode() + top.hashCode();
            hash = h;
        }
        return h;
    }

    /**
     * Bottom-to-top, comma separated; ε for the empty stack.
     */
    @Override
    public String toString() {
        return isEmpty() ? "ε" : String.join(",", toList());
    }
}
