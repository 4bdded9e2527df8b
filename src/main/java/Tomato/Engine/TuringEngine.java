package Tomato.Engine;

import Tomato.Index.TransitionIndex;
import Tomato.Model.InputTokenizer;
import Tomato.Model.MachineDefinition;
import Tomato.Model.RunOptions;
import Tomato.Model.Symbol;
import Tomato.Model.Tape;
import Tomato.Model.Transition;
import Tomato.Trace.StepEvent;
import Tomato.Trace.TraceRecorder;
import Tomato.Trace.TuringConfiguration;
import Tomato.Trace.Verdict;
import net.automatalib.word.Word;

/**
 * Single-tape Turing machines. The input is written to cells 0..n-1 with the head on cell 0.
 * <p>
 * If several transitions match, the first declared one is taken. A machine with no applicable
 * transition halts; under {@link RunOptions.TuringAcceptance#HALT} it accepts if it halted in an
 * accepting state, under {@link RunOptions.TuringAcceptance#STATE} it accepts as soon as it enters one
 * and halting anywhere else rejects. Runs always end within {@link RunOptions#maxSteps()} steps.
 */
public final class TuringEngine extends AbstractEngine {

    TuringEngine(MachineDefinition definition, TransitionIndex index) {
        super(definition, index);
    }

    @Override
    public TuringSimulation start(Word<Symbol> input, RunOptions options, TraceRecorder recorder) {
        return new TuringSimulation(index, input, options, recorder);
    }

    @Override
    public Word<Symbol> tokenize(String raw) {
        return InputTokenizer.tokenize(raw, definition.tapeAlphabet());
    }

    public static final class TuringSimulation extends AbstractSimulation<TuringConfiguration> {
        private final Tape tape;
        private int head;
        private int state;

        TuringSimulation(TransitionIndex index, Word<Symbol> input, RunOptions options, TraceRecorder recorder) {
            super(index, input, options, recorder);
            this.tape = Tape.of(input, definition.blankSymbol());
            this.state = definition.stateId(definition.startState().name());
            this.current = snapshot();
        }

        @Override
        protected StepEvent doStep() {
            boolean accepting = definition.isAccepting(state);
            boolean stateAccept = options.turingAcceptance() == RunOptions.TuringAcceptance.STATE;
            if (stateAccept && accepting) {
                return halt(0, Verdict.ACCEPT);
            }
            Transition t = index.first(state, tape.read(head));
            if (t == null) {
                return halt(0, !stateAccept && accepting ? Verdict.ACCEPT : Verdict.REJECT);
            }
            if (stepLimitReached()) {
                return halt(0, Verdict.TIMEOUT);
            }
            TuringConfiguration before = current;
            tape.write(head, t.write());
            head += t.move().offset();
            state = index.target(t);
            return move(0, before, t, snapshot());
        }

        public Tape tape() {
            return tape.copy();
        }

        public int head() {
            return head;
        }

        private TuringConfiguration snapshot() {
            return new TuringConfiguration(definition.state(state).name(), tape.copy(), head);
        }
    }
}
