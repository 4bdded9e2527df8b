package Tomato.Model;

import java.util.Objects;

/**
 * A token of an input, output, stack or tape alphabet.
 * Ordinary symbols are compared by their text. The two sentinels {@link #EPSILON} and {@link #BLANK}
 * never equal an ordinary symbol, even one spelled the same way.
 */
public final class Symbol implements Comparable<Symbol> {
    /** Consumes no input (NFA, PDA) or pops / pushes nothing (PDA stack side). */
    public static final Symbol EPSILON = new Symbol("ε", true);
    /** Default content of every Turing tape cell. */
    public static final Symbol BLANK = new Symbol("β", true);

    private final String text;
    private final boolean sentinel;

    private Symbol(String text, boolean sentinel) {
        this.text = text;
        this.sentinel = sentinel;
    }

    public static Symbol of(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("A symbol needs at least one character");
        }
        return new Symbol(text, false);
    }

    public static Symbol of(char c) {
        return new Symbol(String.valueOf(c), false);
    }

    public String text() {
        return text;
    }

    public boolean isSentinel() {
        return sentinel;
    }

    public boolean isEpsilon() {
        return this == EPSILON;
    }

    public boolean isBlank() {
        return this == BLANK;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Symbol)) {
            return false;
        }
        Symbol other = (Symbol) o;
        // sentinels are singletons, so identity already covered them
        return !sentinel && !other.sentinel && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return sentinel ? System.identityHashCode(this) : text.hashCode();
    }

    @Override
    public int compareTo(Symbol o) {
        if (sentinel != o.sentinel) {
            return sentinel ? -1 : 1;
        }
        return text.compareTo(o.text);
    }

    @Override
    public String toString() {
        return text;
    }
}
