package Tomato.Engine;

import Tomato.Index.TransitionIndex;
import Tomato.Model.MachineDefinition;
import Tomato.Model.RunOptions;
import Tomato.Model.Symbol;
import Tomato.Model.Transition;
import Tomato.Trace.FiniteConfiguration;
import Tomato.Trace.StepEvent;
import Tomato.Trace.TraceRecorder;
import Tomato.Trace.Verdict;
import net.automatalib.word.Word;

/**
 * Deterministic finite automata. Validation guarantees one transition per (state, symbol), so a
 * run is a single path with no backtracking.
 */
public final class DfaEngine extends AbstractEngine {
    public static final int REJECT = -1;

    DfaEngine(MachineDefinition definition, TransitionIndex index) {
        super(definition, index);
    }

    /**
     * @return the successor state id, or {@link #REJECT} if {@code symbol} is not in the alphabet
     */
    public int step(int state, Symbol symbol) {
        Transition t = index.first(state, symbol);
        return t == null ? REJECT : index.target(t);
    }

    /**
     * Read the whole word in one go, without producing events.
     */
    public boolean accepts(Word<Symbol> input) {
        int state = definition.stateId(definition.startState().name());
        for (Symbol symbol : input) {
            state = step(state, symbol);
            if (state == REJECT) {
                return false;
            }
        }
        return definition.isAccepting(state);
    }

    @Override
    public DfaSimulation start(Word<Symbol> input, RunOptions options, TraceRecorder recorder) {
        return new DfaSimulation(index, input, options, recorder);
    }

    static final class DfaSimulation extends AbstractSimulation<FiniteConfiguration> {
        private int state;

        DfaSimulation(TransitionIndex index, Word<Symbol> input, RunOptions options, TraceRecorder recorder) {
            super(index, input, options, recorder);
            this.state = definition.stateId(definition.startState().name());
            this.current = FiniteConfiguration.of(definition.state(state).name(), input, 0);
        }

        @Override
        protected StepEvent doStep() {
            int position = current.position();
            if (position >= input.length()) {
                return halt(0, definition.isAccepting(state) ? Verdict.ACCEPT : Verdict.REJECT);
            }
            Transition t = index.first(state, input.getSymbol(position));
            if (t == null) {
                return halt(0, Verdict.REJECT);
            }
            FiniteConfiguration before = current;
            state = index.target(t);
            return move(0, before, t, FiniteConfiguration.of(t.to(), input, position + 1));
        }
    }
}
