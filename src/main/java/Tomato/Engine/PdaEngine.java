package Tomato.Engine;

import Tomato.Index.TransitionIndex;
import Tomato.Model.MachineDefinition;
import Tomato.Model.RunOptions;
import Tomato.Model.Symbol;
import Tomato.Model.SymbolStack;
import Tomato.Model.Transition;
import Tomato.Trace.PushdownConfiguration;
import Tomato.Trace.TraceRecorder;
import net.automatalib.word.Word;

import java.util.ArrayList;
import java.util.List;

/**
 * Pushdown automata, explored depth-first: every branch carries its own stack.
 * <p>
 * A transition applies when its input side is EPSILON or the next input symbol, and its pop side is
 * EPSILON or the symbol on top of the stack. A transition that must pop from an empty stack ends its
 * branch. Acceptance, checked once the input is exhausted, follows
 * {@link RunOptions#stackAcceptance()}. Since EPSILON moves may grow the stack forever, a branch is
 * cut after {@link RunOptions#maxSteps()} EPSILON moves in a row; the input length is not limited.
 */
public final class PdaEngine extends AbstractEngine {

    PdaEngine(MachineDefinition definition, TransitionIndex index) {
        super(definition, index);
    }

    public SymbolStack initialStack() {
        Symbol bottom = definition.initialStackSymbol();
        return bottom == null ? SymbolStack.empty() : SymbolStack.empty().push(bottom);
    }

    @Override
    public Simulation start(Word<Symbol> input, RunOptions options, TraceRecorder recorder) {
        PushdownConfiguration initial =
            new PushdownConfiguration(definition.startState().name(), input, 0, initialStack());
        return new PdaSimulation(index, input, options, recorder, initial);
    }

    static final class PdaSimulation extends SearchSimulation<PushdownConfiguration> {

        PdaSimulation(TransitionIndex index, Word<Symbol> input, RunOptions options, TraceRecorder recorder,
                      PushdownConfiguration initial) {
            super(index, input, options, recorder, initial, true);
        }

        @Override
        protected List<Successor<PushdownConfiguration>> successors(PushdownConfiguration c) {
            int state = definition.stateId(c.state());
            Symbol next = c.inputExhausted() ? null : input.getSymbol(c.position());
            SymbolStack stack = c.stack();
            List<Successor<PushdownConfiguration>> result = new ArrayList<>();
            for (Transition t : index.outgoing(state)) {
                int position;
                if (t.isEpsilon()) {
                    position = c.position();
                } else if (t.read().equals(next)) {
                    position = c.position() + 1;
                } else {
                    continue;
                }
                SymbolStack base;
                if (!t.popsSomething()) {
                    base = stack;
                } else if (stack.isEmpty()) {
                    result.add(new Successor<>(t, null)); // stack underflow
                    continue;
                } else if (t.pop().equals(stack.peek())) {
                    base = stack.pop();
                } else {
                    continue;
                }
                result.add(new Successor<>(t, new PushdownConfiguration(t.to(), input, position, base.pushAll(t.push()))));
            }
            return result;
        }

        @Override
        protected boolean isAccepting(PushdownConfiguration c) {
            if (!c.inputExhausted()) {
                return false;
            }
            return (options.acceptsByFinalState() && definition.isAccepting(definition.stateId(c.state())))
                || (options.acceptsByEmptyStack() && c.stack().isEmpty());
        }

        @Override
        protected Object visitKey(PushdownConfiguration c) {
            return new Visit(c.state(), c.position(), c.stack());
        }

        @Override
        protected int position(PushdownConfiguration c) {
            return c.position();
        }
    }

    private record Visit(String state, int position, SymbolStack stack) { }
}
