package Tomato.Convert;

import Tomato.Index.TransitionIndex;
import Tomato.Index.TransitionIndexes;
import Tomato.Model.MachineDefinition;
import Tomato.Model.MachineValidator;
import Tomato.Model.ModelType;
import Tomato.Model.Symbol;
import Tomato.Model.Transition;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Set;

/**
 * Moves finite automata between {@link MachineDefinition} and AutomataLib's compact automata.
 */
public final class AutomatonBridge {
    public static final String UNIFIED_START = "start";

    private AutomatonBridge() {
    }

    /**
     * EPSILON-free copy of a DFA or NFA over the same alphabet. State ids are kept. The initial states
     * are the EPSILON closure of the start state, and every transition {@code s -a-> t} becomes
     * {@code s -a-> u} for each {@code u} in the closure of {@code t}.
     */
    public static CompactNFA<Symbol> toCompactNFA(MachineDefinition definition) {
        requireFiniteAutomaton(definition);
        MachineValidator.validate(definition);
        TransitionIndex index = TransitionIndexes.of(definition);
        Alphabet<Symbol> alphabet = definition.inputAlphabet();

        CompactNFA<Symbol> nfa = new CompactNFA<>(alphabet, definition.size());
        for (int i = 0; i < definition.size(); i++) {
            nfa.addState(definition.isAccepting(i));
        }
        BitSet start = new BitSet();
        start.set(definition.stateId(definition.startState().name()));
        BitSet initial = index.epsilonClosure(start);
        for (int i = initial.nextSetBit(0); i >= 0; i = initial.nextSetBit(i + 1)) {
            nfa.setInitial(i, true);
        }

        for (Transition t : definition.transitions()) {
            if (t.isEpsilon()) {
                continue;
            }
            int from = definition.stateId(t.from());
            int symbol = alphabet.getSymbolIndex(t.read());
            BitSet target = new BitSet();
            target.set(index.target(t));
            BitSet closure = index.epsilonClosure(target);
            for (int u = closure.nextSetBit(0); u >= 0; u = closure.nextSetBit(u + 1)) {
                nfa.addTransition(from, symbol, u);
            }
        }
        return nfa;
    }

    /**
     * Copy of a DFA definition as a {@link CompactDFA}.
     */
    public static CompactDFA<Symbol> toCompactDFA(MachineDefinition definition) {
        if (definition.type() != ModelType.DFA) {
            throw new IllegalArgumentException("Expected a DFA, got " + definition.type());
        }
        MachineValidator.validate(definition);
        CompactDFA<Symbol> dfa = new CompactDFA<>(definition.inputAlphabet(), definition.size());
        for (int i = 0; i < definition.size(); i++) {
            dfa.addState(definition.isAccepting(i));
        }
        dfa.setInitialState(definition.stateId(definition.startState().name()));
        Alphabet<Symbol> inputs = definition.inputAlphabet();
        for (Transition t : definition.transitions()) {
            dfa.setTransition(definition.stateId(t.from()), inputs.getSymbolIndex(t.read()), definition.stateId(t.to()));
        }
        return dfa;
    }

    /**
     * NFA definition from an AutomataLib NFA, states named {@code q<id>}. Several initial states are
     * joined under a fresh start state with EPSILON transitions to each of them.
     */
    public static <I> MachineDefinition fromCompactNFA(CompactNFA<I> nfa) {
        MachineDefinition.Builder builder = MachineDefinition.builder(ModelType.NFA);
        Set<Integer> initials = nfa.getInitialStates();
        boolean unify = initials.size() != 1;
        String start = unify ? UNIFIED_START : null;
        if (unify) {
            builder.addState(start, true, false);
        }
        for (int s = 0; s < nfa.size(); s++) {
            builder.addState(name(s), !unify && initials.contains(s), nfa.isAccepting(s));
        }
        if (unify) {
            for (int s : initials) {
                builder.addTransition(Transition.epsilon(start, name(s)));
            }
        }

        Alphabet<I> alphabet = nfa.getInputAlphabet();
        List<Symbol> symbols = new ArrayList<>(alphabet.size());
        for (I label : alphabet) {
            symbols.add(symbol(label));
        }
        builder.inputAlphabet(symbols);
        for (int s = 0; s < nfa.size(); s++) {
            for (I label : alphabet) {
                for (int t : nfa.getTransitions(s, label)) {
                    builder.addTransition(Transition.of(name(s), symbol(label), name(t)));
                }
            }
        }
        return builder.build();
    }

    private static Symbol symbol(Object label) {
        return Symbol.of(String.valueOf(label));
    }

    static String name(int state) {
        return "q" + state;
    }

    private static void requireFiniteAutomaton(MachineDefinition definition) {
        if (definition.type() != ModelType.DFA && definition.type() != ModelType.NFA) {
            throw new IllegalArgumentException("Expected a DFA or NFA, got " + definition.type());
        }
    }
}
