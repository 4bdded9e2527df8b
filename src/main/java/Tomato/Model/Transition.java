package Tomato.Model;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * {@code (from, read, extra?) -> (to, effects)}.
 * Which of the optional parts are set depends on the model:
 * <ul>
 *     <li>DFA / NFA / Moore: none.</li>
 *     <li>Mealy: {@code output}.</li>
 *     <li>PDA: {@code pop} (EPSILON = nothing popped) and {@code push}, listed in push order,
 *     so the first symbol ends up deepest.</li>
 *     <li>Turing: {@code write} and {@code move}; {@code read} is the symbol under the head.</li>
 * </ul>
 * Use the static factories; the canonical constructor accepts anything so that malformed
 * transitions can still reach {@link MachineValidator}.
 */
public record Transition(String from, Symbol read, String to,
                         Symbol pop, List<Symbol> push,
                         Symbol output,
                         Symbol write, Move move) {

    public Transition {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(read, "read");
        Objects.requireNonNull(to, "to");
        push = push == null ? List.of() : List.copyOf(push);
    }

    public static Transition of(String from, Symbol read, String to) {
        return new Transition(from, read, to, null, null, null, null, null);
    }

    public static Transition epsilon(String from, String to) {
        return of(from, Symbol.EPSILON, to);
    }

    public static Transition mealy(String from, Symbol read, String to, Symbol output) {
        return new Transition(from, read, to, null, null, output, null, null);
    }

    public static Transition pda(String from, Symbol read, Symbol pop, String to, List<Symbol> push) {
        return new Transition(from, read, to, pop == null ? Symbol.EPSILON : pop, push, null, null, null);
    }

    public static Transition turing(String from, Symbol read, String to, Symbol write, Move move) {
        return new Transition(from, read, to, null, null, null, write, move);
    }

    public boolean isEpsilon() {
        return read.isEpsilon();
    }

    public boolean popsSomething() {
        return pop != null && !pop.isEpsilon();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(from).append(" --").append(read);
        if (pop != null) {
            StringJoiner pushed = new StringJoiner("");
            push.forEach(s -> pushed.add(s.text()));
            sb.append(", ").append(pop).append(" / ").append(push.isEmpty() ? Symbol.EPSILON.text() : pushed.toString());
        }
        if (output != null) {
            sb.append(" / ").append(output);
        }
        if (write != null || move != null) {
            sb.append(" / ").append(write).append(", ").append(move);
        }
        return sb.append("--> ").append(to).toString();
    }
}
