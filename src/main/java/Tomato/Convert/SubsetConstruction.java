package Tomato.Convert;

import Tomato.Model.MachineDefinition;
import Tomato.Model.ModelType;
import Tomato.Model.Symbol;
import Tomato.Model.Transition;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.ts.AcceptorPowersetViewTS;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Subset construction from a DFA or NFA definition to an equivalent, complete DFA definition.
 * <p>
 * Only reachable subsets are built. Each DFA state is named after its subset, e.g. {@code {q0,q2}},
 * and the empty subset {@code {}} is the dead state.
 */
public final class SubsetConstruction {
    private static final Logger LOG = LoggerFactory.getLogger(SubsetConstruction.class);

    private SubsetConstruction() {
    }

    public static MachineDefinition toDfa(MachineDefinition definition) {
        CompactNFA<Symbol> nfa = AutomatonBridge.toCompactNFA(definition);
        Alphabet<Symbol> alphabet = definition.inputAlphabet();
        AcceptorPowersetViewTS<BitSet, Symbol, Integer> powerset = nfa.powersetView();

        MachineDefinition.Builder out = MachineDefinition.builder(ModelType.DFA).inputAlphabet(alphabet);
        Map<BitSet, String> outStateMap = new HashMap<>();
        Deque<BitSet> stack = new ArrayDeque<>();

        BitSet init = powerset.getInitialState();
        String initOut = name(definition, init);
        out.addState(initOut, true, powerset.isAccepting(init));
        outStateMap.put(init, initOut);
        stack.push(init);

        while (!stack.isEmpty()) {
            BitSet inState = stack.pop();
            String outState = outStateMap.get(inState);

            for (Symbol sym : alphabet) {
                BitSet succ = powerset.getSuccessor(inState, sym);
                if (succ == null) {
                    succ = new BitSet();
                }
                String outSucc = outStateMap.get(succ);
                if (outSucc == null) {
                    outSucc = name(definition, succ);
                    out.addState(outSucc, false, powerset.isAccepting(succ));
                    outStateMap.put(succ, outSucc);
                    stack.push(succ);
                }
                out.addTransition(Transition.of(outState, sym, outSucc));
            }
        }
        LOG.debug("Subset construction: {} states -> {} states", definition.size(), outStateMap.size());
        return out.build();
    }

    /**
     * Minimal DFA for the language of a DFA definition, by Hopcroft's algorithm.
     */
    public static CompactDFA<Symbol> minimize(MachineDefinition dfa) {
        return HopcroftMinimizer.minimizeDFA(AutomatonBridge.toCompactDFA(dfa), dfa.inputAlphabet());
    }

    private static String name(MachineDefinition definition, BitSet states) {
        StringJoiner joiner = new StringJoiner(",", "{", "}");
        for (int i = states.nextSetBit(0); i >= 0; i = states.nextSetBit(i + 1)) {
            joiner.add(definition.state(i).name());
        }
        return joiner.toString();
    }
}
