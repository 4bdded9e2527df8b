package Tomato.Engine;

import Tomato.Index.TransitionIndex;
import Tomato.Model.RunOptions;
import Tomato.Model.Symbol;
import Tomato.Model.Transition;
import Tomato.Trace.Configuration;
import Tomato.Trace.StepEvent;
import Tomato.Trace.StepKind;
import Tomato.Trace.TraceRecorder;
import Tomato.Trace.Verdict;
import net.automatalib.word.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Depth-first exploration of one path at a time, with an explicit frontier instead of recursion.
 * Choices are tried in transition declaration order; the first accepting configuration ends the
 * run, and the run rejects once the frontier is empty.
 * <p>
 * A configuration that was already reached is not expanded again. Whether a configuration can lead
 * to acceptance depends on nothing else, so this is sound, and it stops EPSILON cycles that change
 * neither input nor stack.
 * <p>
 * When step limited, a branch may make at most {@link RunOptions#maxSteps()} moves in a row without
 * reading input; longer EPSILON chains are cut. Moves that read input never count, so long inputs
 * are not limited. A run whose frontier empties after a cut ends with {@link Verdict#TIMEOUT}
 * instead of {@link Verdict#REJECT}.
 */
abstract class SearchSimulation<C extends Configuration> extends AbstractSimulation<C> {
    private static final Logger LOG = LoggerFactory.getLogger(SearchSimulation.class);

    private final Deque<Attempt<C>> frontier = new ArrayDeque<>();
    private final Set<Object> visited = new HashSet<>();
    private final boolean stepLimited;
    private int nextBranch = 1;
    private boolean truncated;
    private C accepted;

    /**
     * A pending move: {@code transition} leads from {@code before} to {@code after}.
     * A null {@code after} marks a move that cannot be applied (pop on an empty stack).
     * {@code idle} counts the moves without input since the branch last read a symbol.
     */
    protected record Attempt<C>(int branchId, C before, Transition transition, C after, int idle) { }

    /**
     * One applicable (or failing) transition out of a configuration.
     */
    protected record Successor<C>(Transition transition, C after) { }

    SearchSimulation(TransitionIndex index, Word<Symbol> input, RunOptions options, TraceRecorder recorder,
                     C initial, boolean stepLimited) {
        super(index, input, options, recorder);
        this.stepLimited = stepLimited;
        this.current = initial;
        frontier.push(new Attempt<>(0, null, null, initial, 0));
    }

    /**
     * @return successors in declaration order
     */
    protected abstract List<Successor<C>> successors(C configuration);

    protected abstract boolean isAccepting(C configuration);

    /**
     * @return value identifying the configuration for the visited check
     */
    protected abstract Object visitKey(C configuration);

    /**
     * @return number of input symbols read
     */
    protected abstract int position(C configuration);

    @Override
    protected StepEvent doStep() {
        Attempt<C> attempt = frontier.pop();
        C reached = attempt.after();
        if (reached == null) {
            LOG.trace("Branch {} died: {} needs a pop on an empty stack", attempt.branchId(), attempt.transition());
            return dead(attempt, attempt.before());
        }
        if (stepLimited && attempt.idle() > cancellation.getStepThreshold()) {
            LOG.debug("Branch {} cut after {} moves without input", attempt.branchId(), cancellation.getStepThreshold());
            truncated = true;
            return dead(attempt, attempt.before());
        }
        current = reached;
        if (!visited.add(visitKey(reached))) {
            return dead(attempt, reached);
        }
        if (isAccepting(reached)) {
            accepted = reached;
            return new StepEvent(attempt.branchId(), StepKind.HALT, attempt.before(), attempt.transition(),
                                 reached, Verdict.ACCEPT);
        }
        List<Successor<C>> next = successors(reached);
        if (next.isEmpty()) {
            return dead(attempt, reached);
        }
        // first choice continues the branch, the others open new ones; push in reverse so the first is on top
        int[] branchIds = new int[next.size()];
        branchIds[0] = attempt.branchId();
        for (int i = 1; i < branchIds.length; i++) {
            branchIds[i] = nextBranch++;
        }
        for (int i = next.size() - 1; i >= 0; i--) {
            Successor<C> s = next.get(i);
            int idle = s.after() != null && position(s.after()) > position(reached) ? 0 : attempt.idle() + 1;
            frontier.push(new Attempt<>(branchIds[i], reached, s.transition(), s.after(), idle));
        }
        return new StepEvent(attempt.branchId(), StepKind.MOVE, attempt.before(), attempt.transition(),
                             reached, Verdict.RUNNING);
    }

    private StepEvent dead(Attempt<C> attempt, C at) {
        Verdict verdict = !frontier.isEmpty() ? Verdict.RUNNING
            : truncated ? Verdict.TIMEOUT : Verdict.REJECT;
        return new StepEvent(attempt.branchId(), StepKind.DEAD_BRANCH, attempt.before(), attempt.transition(),
                             at, verdict);
    }

    @Override
    protected Configuration resultConfiguration() {
        return accepted != null ? accepted : current;
    }

    /**
     * @return number of attempts still waiting on the frontier
     */
    public int pending() {
        return frontier.size();
    }
}
