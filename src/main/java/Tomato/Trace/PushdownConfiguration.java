package Tomato.Trace;

import Tomato.Model.Symbol;
import Tomato.Model.SymbolStack;
import net.automatalib.word.Word;

import java.util.Set;

public record PushdownConfiguration(String state, Word<Symbol> input, int position, SymbolStack stack)
    implements Configuration {

    @Override
    public Set<String> states() {
        return Set.of(state);
    }

    public Word<Symbol> remaining() {
        return input.subWord(position);
    }

    public boolean inputExhausted() {
        return position >= input.length();
    }

    @Override
    public String toString() {
        return state + " | " + remaining() + " | " + stack;
    }
}
