package Tomato.Engine;

import Tomato.Index.TransitionIndex;
import Tomato.Model.MachineDefinition;
import Tomato.Model.RunOptions;
import Tomato.Model.Symbol;
import Tomato.Model.Transition;
import Tomato.Trace.FiniteConfiguration;
import Tomato.Trace.StepEvent;
import Tomato.Trace.StepKind;
import Tomato.Trace.TraceRecorder;
import Tomato.Trace.Verdict;
import net.automatalib.word.Word;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Nondeterministic finite automata with EPSILON transitions.
 * <p>
 * {@link RunOptions.NfaMode#SUBSET} advances the whole set of active states per input symbol.
 * {@link RunOptions.NfaMode#BACKTRACK} follows one path at a time, which is what a step-through
 * viewer shows. Both modes give the same verdict.
 */
public final class NfaEngine extends AbstractEngine {
    private final BitSet acceptingStates;
    private final int startState;

    NfaEngine(MachineDefinition definition, TransitionIndex index) {
        super(definition, index);
        this.acceptingStates = new BitSet(definition.size());
        for (int i = 0; i < definition.size(); i++) {
            if (definition.isAccepting(i)) {
                acceptingStates.set(i);
            }
        }
        this.startState = definition.stateId(definition.startState().name());
    }

    /**
     * @return EPSILON closure of the start state
     */
    public BitSet initialStates() {
        BitSet start = new BitSet(definition.size());
        start.set(startState);
        return index.epsilonClosure(start);
    }

    /**
     * One subset step: read {@code symbol} from every active state, then close over EPSILON.
     */
    public BitSet successor(BitSet active, Symbol symbol) {
        return index.epsilonClosure(index.move(active, symbol));
    }

    public boolean isAccepting(BitSet active) {
        return active.intersects(acceptingStates);
    }

    /**
     * Subset simulation of the whole word, without producing events.
     */
    public boolean accepts(Word<Symbol> input) {
        BitSet active = initialStates();
        for (Symbol symbol : input) {
            active = successor(active, symbol);
            if (active.isEmpty()) {
                return false;
            }
        }
        return isAccepting(active);
    }

    @Override
    public Simulation start(Word<Symbol> input, RunOptions options, TraceRecorder recorder) {
        return switch (options.nfaMode()) {
            case SUBSET -> new SubsetSimulation(input, options, recorder);
            case BACKTRACK -> new BacktrackSimulation(input, options, recorder);
        };
    }

    Set<String> names(BitSet states) {
        Set<String> result = new LinkedHashSet<>();
        for (int i = states.nextSetBit(0); i >= 0; i = states.nextSetBit(i + 1)) {
            result.add(definition.state(i).name());
        }
        return result;
    }

    final class SubsetSimulation extends AbstractSimulation<FiniteConfiguration> {
        private BitSet active;

        SubsetSimulation(Word<Symbol> input, RunOptions options, TraceRecorder recorder) {
            super(NfaEngine.this.index, input, options, recorder);
            this.active = initialStates();
            this.current = new FiniteConfiguration(names(active), input, 0);
        }

        public BitSet activeStates() {
            return (BitSet) active.clone();
        }

        @Override
        protected StepEvent doStep() {
            int position = current.position();
            if (position >= input.length()) {
                return halt(0, isAccepting(active) ? Verdict.ACCEPT : Verdict.REJECT);
            }
            FiniteConfiguration before = current;
            active = successor(active, input.getSymbol(position));
            FiniteConfiguration after = new FiniteConfiguration(names(active), input, position + 1);
            if (active.isEmpty()) {
                current = after;
                return new StepEvent(0, StepKind.DEAD_BRANCH, before, null, after, Verdict.REJECT);
            }
            return move(0, before, null, after);
        }
    }

    final class BacktrackSimulation extends SearchSimulation<FiniteConfiguration> {

        BacktrackSimulation(Word<Symbol> input, RunOptions options, TraceRecorder recorder) {
            super(NfaEngine.this.index, input, options, recorder,
                  FiniteConfiguration.of(NfaEngine.this.definition.state(startState).name(), input, 0), false);
        }

        @Override
        protected List<Successor<FiniteConfiguration>> successors(FiniteConfiguration c) {
            int state = definition.stateId(c.states().iterator().next());
            Symbol next = c.inputExhausted() ? null : input.getSymbol(c.position());
            List<Successor<FiniteConfiguration>> result = new ArrayList<>();
            for (Transition t : index.outgoing(state)) {
                if (t.isEpsilon()) {
                    result.add(new Successor<>(t, FiniteConfiguration.of(t.to(), input, c.position())));
                } else if (t.read().equals(next)) {
                    result.add(new Successor<>(t, FiniteConfiguration.of(t.to(), input, c.position() + 1)));
                }
            }
            return result;
        }

        @Override
        protected boolean isAccepting(FiniteConfiguration c) {
            return c.inputExhausted() && definition.isAccepting(definition.stateId(c.states().iterator().next()));
        }

        @Override
        protected Object visitKey(FiniteConfiguration c) {
            return new Visit(c.states().iterator().next(), c.position());
        }

        @Override
        protected int position(FiniteConfiguration c) {
            return c.position();
        }
    }

    private record Visit(String state, int position) { }
}
