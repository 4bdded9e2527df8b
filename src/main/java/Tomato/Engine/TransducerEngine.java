package Tomato.Engine;

import Tomato.Index.TransitionIndex;
import Tomato.Model.MachineDefinition;
import Tomato.Model.ModelType;
import Tomato.Model.RunOptions;
import Tomato.Model.Symbol;
import Tomato.Model.Transition;
import Tomato.Trace.NoOpTraceRecorder;
import Tomato.Trace.StepEvent;
import Tomato.Trace.TraceRecorder;
import Tomato.Trace.TransducerConfiguration;
import Tomato.Trace.Verdict;
import net.automatalib.word.Word;

/**
 * Mealy and Moore machines. Each input symbol emits one output symbol: the transition's output for
 * Mealy, the target state's output for Moore. A Moore run can also emit the start state's output
 * first, see {@link RunOptions#moorePreOutput()}.
 * <p>
 * These machines do not accept or reject; a run that reads its whole input ends with
 * {@link Verdict#COMPLETE}. An input symbol outside the alphabet stops the run with
 * {@link Verdict#REJECT}, keeping the output emitted so far.
 */
public final class TransducerEngine extends AbstractEngine {

    TransducerEngine(MachineDefinition definition, TransitionIndex index) {
        super(definition, index);
    }

    /**
     * Translate the whole word without producing events.
     *
     * @return the output, or null if the machine got stuck on a symbol outside its alphabet
     */
    public Word<Symbol> translate(Word<Symbol> input, RunOptions options) {
        TransducerSimulation simulation = start(input, options, NoOpTraceRecorder.INSTANCE);
        return simulation.run().verdict() == Verdict.COMPLETE ? simulation.output() : null;
    }

    @Override
    public TransducerSimulation start(Word<Symbol> input, RunOptions options, TraceRecorder recorder) {
        return new TransducerSimulation(index, input, options, recorder);
    }

    static final class TransducerSimulation extends AbstractSimulation<TransducerConfiguration> {
        private final boolean mealy;
        private int state;

        TransducerSimulation(TransitionIndex index, Word<Symbol> input, RunOptions options, TraceRecorder recorder) {
            super(index, input, options, recorder);
            this.mealy = definition.type() == ModelType.MEALY;
            this.state = definition.stateId(definition.startState().name());
            Word<Symbol> output = !mealy && options.moorePreOutput()
                ? Word.fromLetter(definition.state(state).output())
                : Word.epsilon();
            this.current = new TransducerConfiguration(definition.state(state).name(), input, 0, output);
        }

        @Override
        protected StepEvent doStep() {
            int position = current.position();
            if (position >= input.length()) {
                return halt(0, Verdict.COMPLETE);
            }
            Transition t = index.first(state, input.getSymbol(position));
            if (t == null) {
                return halt(0, Verdict.REJECT);
            }
            TransducerConfiguration before = current;
            state = index.target(t);
            Symbol emitted = mealy ? t.output() : definition.state(state).output();
            return move(0, before, t,
                        new TransducerConfiguration(t.to(), input, position + 1, before.output().append(emitted)));
        }

        @Override
        public Word<Symbol> output() {
            return current.output();
        }
    }
}
