package Tomato.Trace;

import Tomato.Model.Tape;

import java.util.Set;

/**
 * Turing configuration. The tape is a private copy; do not write to it.
 */
public record TuringConfiguration(String state, Tape tape, int head) implements Configuration {

    @Override
    public Set<String> states() {
        return Set.of(state);
    }

    @Override
    public String toString() {
        return state + " | " + tape + " @" + head;
    }
}
