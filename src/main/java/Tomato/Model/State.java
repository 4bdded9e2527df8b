package Tomato.Model;

import java.util.Objects;

/**
 * A named state. {@code output} is only set for Moore machines.
 */
public record State(String name, boolean start, boolean accepting, Symbol output) {

    public State {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("State names must not be blank");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
