package Tomato.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable, structure-sharing stack of symbols. Every PDA branch owns its own stack value;
 * pushing onto a shared prefix never affects another branch.
 */
public final class SymbolStack {
    private static final SymbolStack EMPTY = new SymbolStack(null, null, 0, 1);

    private final Symbol top;
    private final SymbolStack rest;
    private final int size;
    private final int hash;

    private SymbolStack(Symbol top, SymbolStack rest, int size, int hash) {
        this.top = top;
        this.rest = rest;
        this.size = size;
        this.hash = hash;
    }

    public static SymbolStack empty() {
        return EMPTY;
    }

    /**
     * @param bottomToTop symbols in push order
     */
    public static SymbolStack of(List<Symbol> bottomToTop) {
        return EMPTY.pushAll(bottomToTop);
    }

    public SymbolStack push(Symbol symbol) {
        return new SymbolStack(symbol, this, size + 1, 31 * hash + symbol.hashCode());
    }

    /**
     * Push in list order, so the first element ends up deepest.
     */
    public SymbolStack pushAll(List<Symbol> symbols) {
        SymbolStack result = this;
        for (Symbol s : symbols) {
            result = result.push(s);
        }
        return result;
    }

    /**
     * @return the stack below the top, or null when empty
     */
    public SymbolStack pop() {
        return rest;
    }

    /**
     * @return top symbol, or null when empty
     */
    public Symbol peek() {
        return top;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    /**
     * @return symbols from bottom to top
     */
    public List<Symbol> toList() {
        List<Symbol> result = new ArrayList<>(size);
        for (SymbolStack s = this; s.size > 0; s = s.rest) {
            result.add(s.top);
        }
        Collections.reverse(result);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SymbolStack)) {
            return false;
        }
        SymbolStack a = this;
        SymbolStack b = (SymbolStack) o;
        if (a.size != b.size || a.hash != b.hash) {
            return false;
        }
        while (a.size > 0) {
            if (a == b) {
                return true; // shared tail
            }
            if (!a.top.equals(b.top)) {
                return false;
            }
            a = a.rest;
            b = b.rest;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (Symbol s : toList()) {
            sb.append(s.text());
        }
        return sb.append('>').toString();
    }
}
