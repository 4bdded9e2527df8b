package Tomato.Engine;

import Tomato.Model.InputTokenizer;
import Tomato.Model.MachineDefinition;
import Tomato.Model.RunOptions;
import Tomato.Model.Symbol;
import Tomato.Trace.NoOpTraceRecorder;
import Tomato.Trace.RunResult;
import Tomato.Trace.TraceRecorder;
import net.automatalib.word.Word;

/**
 * Simulates one validated definition. Engines hold no per-run state, so one engine can start any
 * number of independent simulations.
 */
public interface Engine {

    MachineDefinition definition();

    /**
     * Start a run without performing any step yet.
     *
     * @param input    input word, or initial tape contents for Turing machines
     * @param options  per-run choices
     * @param recorder receives every step event
     */
    Simulation start(Word<Symbol> input, RunOptions options, TraceRecorder recorder);

    default Simulation start(Word<Symbol> input, RunOptions options) {
        return start(input, options, NoOpTraceRecorder.INSTANCE);
    }

    default RunResult run(Word<Symbol> input, RunOptions options, TraceRecorder recorder) {
        return start(input, options, recorder).run();
    }

    default RunResult run(Word<Symbol> input, RunOptions options) {
        return start(input, options).run();
    }

    default RunResult run(Word<Symbol> input) {
        return run(input, RunOptions.defaults());
    }

    /**
     * Tokenize and run raw text, see {@link InputTokenizer}.
     */
    default RunResult run(String input, RunOptions options) {
        return run(tokenize(input), options);
    }

    default Word<Symbol> tokenize(String raw) {
        return InputTokenizer.tokenize(raw, definition().inputAlphabet());
    }
}
