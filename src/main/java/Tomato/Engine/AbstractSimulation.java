package Tomato.Engine;

import Tomato.Index.TransitionIndex;
import Tomato.Model.Cancellation;
import Tomato.Model.MachineDefinition;
import Tomato.Model.RunOptions;
import Tomato.Model.Symbol;
import Tomato.Model.Transition;
import Tomato.Trace.Configuration;
import Tomato.Trace.RunResult;
import Tomato.Trace.StepEvent;
import Tomato.Trace.StepKind;
import Tomato.Trace.TraceRecorder;
import Tomato.Trace.Verdict;
import net.automatalib.word.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bookkeeping shared by all simulations: step counting, cancellation, recording and the verdict.
 * Subclasses only describe what one step does.
 */
abstract class AbstractSimulation<C extends Configuration> implements Simulation {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractSimulation.class);

    protected final MachineDefinition definition;
    protected final TransitionIndex index;
    protected final Word<Symbol> input;
    protected final RunOptions options;
    protected final TraceRecorder recorder;
    protected final Cancellation cancellation;

    protected C current;
    private Verdict verdict = Verdict.RUNNING;
    private int steps;

    AbstractSimulation(TransitionIndex index, Word<Symbol> input, RunOptions options, TraceRecorder recorder) {
        this.definition = index.definition();
        this.index = index;
        this.input = input;
        this.options = options;
        this.recorder = recorder;
        this.cancellation = new Cancellation(options.maxSteps());
    }

    /**
     * Perform one step. Only called while the run is not finished.
     */
    protected abstract StepEvent doStep();

    @Override
    public final StepEvent step() {
        if (isFinished()) {
            throw new IllegalStateException("Simulation already finished with " + verdict);
        }
        StepEvent event = cancellation.isInterrupted()
            ? halt(0, Verdict.CANCELLED)
            : doStep();
        steps++;
        verdict = event.verdict();
        recorder.record(event);
        if (verdict.isFinal()) {
            LOG.debug("{} run on '{}' finished: {} after {} steps", definition.type(), input, verdict, steps);
        }
        return event;
    }

    @Override
    public boolean isFinished() {
        return verdict.isFinal();
    }

    @Override
    public Verdict verdict() {
        return verdict;
    }

    @Override
    public C current() {
        return current;
    }

    @Override
    public int steps() {
        return steps;
    }

    @Override
    public void cancel() {
        cancellation.setInterrupted();
    }

    @Override
    public RunResult run() {
        while (!isFinished()) {
            step();
        }
        return new RunResult(verdict, output(), resultConfiguration(), steps, recorder.events());
    }

    /**
     * Configuration reported in the result; the current one unless a subclass knows better.
     */
    protected Configuration resultConfiguration() {
        return current;
    }

    /**
     * Whether applying one more transition would exceed the step limit. Reports the limit as reached.
     */
    protected boolean stepLimitReached() {
        if (cancellation.isAboveThreshold(steps)) {
            LOG.debug("{} run on '{}' hit the step limit of {}", definition.type(), input,
                      cancellation.getStepThreshold());
            return true;
        }
        return false;
    }

    protected StepEvent move(int branchId, C before, Transition transition, C after) {
        current = after;
        return new StepEvent(branchId, StepKind.MOVE, before, transition, after, Verdict.RUNNING);
    }

    protected StepEvent halt(int branchId, Verdict result) {
        return new StepEvent(branchId, StepKind.HALT, current, null, current, result);
    }
}
