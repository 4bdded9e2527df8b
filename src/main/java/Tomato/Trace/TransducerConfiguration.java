package Tomato.Trace;

import Tomato.Model.Symbol;
import net.automatalib.word.Word;

import java.util.Set;

/**
 * Mealy / Moore configuration with the output emitted so far.
 */
public record TransducerConfiguration(String state, Word<Symbol> input, int position, Word<Symbol> output)
    implements Configuration {

    @Override
    public Set<String> states() {
        return Set.of(state);
    }

    public Word<Symbol> remaining() {
        return input.subWord(position);
    }

    @Override
    public String toString() {
        return state + " | " + remaining() + " | out=" + output;
    }
}
