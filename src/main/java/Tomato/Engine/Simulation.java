package Tomato.Engine;

import Tomato.Model.Symbol;
import Tomato.Trace.Configuration;
import Tomato.Trace.RunResult;
import Tomato.Trace.StepEvent;
import Tomato.Trace.Verdict;
import net.automatalib.word.Word;

/**
 * One run in progress. Advance it with {@link #step()}, either in a loop or paced by a viewer.
 * All state lives in this object; dropping it mid-run needs no cleanup.
 */
public interface Simulation {

    /**
     * Advance exactly one configuration or branch.
     *
     * @return the event describing the step, already passed to the recorder
     * @throws IllegalStateException if the run is finished
     */
    StepEvent step();

    boolean isFinished();

    Verdict verdict();

    /**
     * @return the configuration the last step ended in
     */
    Configuration current();

    int steps();

    /**
     * Output emitted so far; always empty for acceptors.
     */
    default Word<Symbol> output() {
        return Word.epsilon();
    }

    /**
     * Ask the run to stop. The next {@link #step()} ends it with {@link Verdict#CANCELLED}.
     */
    void cancel();

    /**
     * Step until finished.
     */
    RunResult run();
}
