package Tomato.Trace;

import Tomato.Model.Symbol;
import net.automatalib.word.Word;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * DFA / NFA configuration: active states, in state declaration order, and the read position in the input.
 */
public record FiniteConfiguration(Set<String> states, Word<Symbol> input, int position) implements Configuration {

    public FiniteConfiguration {
        states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
    }

    public static FiniteConfiguration of(String state, Word<Symbol> input, int position) {
        return new FiniteConfiguration(Set.of(state), input, position);
    }

    public Word<Symbol> remaining() {
        return input.subWord(position);
    }

    public boolean inputExhausted() {
        return position >= input.length();
    }

    @Override
    public String toString() {
        return states + " | " + remaining();
    }
}
