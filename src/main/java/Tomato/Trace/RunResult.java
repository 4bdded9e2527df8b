package Tomato.Trace;

import Tomato.Model.Symbol;
import net.automatalib.word.Word;

import java.util.List;

/**
 * Summary of a finished run.
 *
 * @param verdict  final verdict
 * @param output   emitted symbols (Mealy / Moore); empty for acceptors
 * @param last     configuration the run ended in; for searches, the accepting one if any
 * @param steps    number of steps taken
 * @param events   recorded events, empty unless a keeping recorder was used
 */
public record RunResult(Verdict verdict, Word<Symbol> output, Configuration last, int steps, List<StepEvent> events) {

    public boolean isAccepted() {
        return verdict == Verdict.ACCEPT;
    }

    /**
     * @return output as text, one symbol after the other
     */
    public String outputString() {
        StringBuilder sb = new StringBuilder();
        for (Symbol s : output) {
            sb.append(s.text());
        }
        return sb.toString();
    }
}
