package Tomato;

import Tomato.Convert.AutomatonBridge;
import Tomato.Model.MachineDefinition;
import Tomato.Model.ModelType;
import Tomato.Model.State;
import Tomato.Model.Symbol;
import Tomato.Model.Transition;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.common.util.random.RandomUtil;

import java.util.List;
import java.util.Random;

public class TabakovVardiRandomNFA {
    public static final Alphabet<Symbol> AB = Alphabets.fromCollection(List.of(Symbol.of("a"), Symbol.of("b")));

    /**
     * Generate random NFA using Tabakov and Vardi's approach, described in the paper
     * <a href="https://doi.org/10.1007/11591191_28">Experimental Evaluation of Classical Automata Constructions</a>
     * by Deian Tabakov and Moshe Y. Vardi.
     *
     * @param r
     *      random instance
     * @param size
     *      number of states
     * @param td
     *      transition density, in [0,size]
     * @param ad
     *      acceptance density, in (0,1]. 0.5 is the usual value
     * @return
     *      a random NFA, not necessarily connected
     */
    public static CompactNFA<Symbol> generateNFA(Random r, int size, float td, float ad, Alphabet<Symbol> alphabet) {
        int edgeNum = Math.round(td * size);
        int acceptNum = Math.max(1, Math.round(ad * size));

        CompactNFA<Symbol> result = new CompactNFA<>(alphabet, size);
        for (int i = 0; i < size; i++) {
            result.addState(false);
        }
        // per the paper, the first state is always initial and accepting
        result.setInitial(0, true);
        result.setAccepting(0, true);

        // exactly acceptNum-1 further final states, from [1,size)
        for (int f : RandomUtil.distinctIntegers(r, acceptNum - 1, 1, size)) {
            result.setAccepting(f, true);
        }
        for (int a = 0; a < alphabet.size(); a++) {
            for (int edgeIndex : RandomUtil.distinctIntegers(r, edgeNum, size * size)) {
                result.addTransition(edgeIndex / size, a, edgeIndex % size);
            }
        }
        return result;
    }

    /**
     * Random NFA definition over {a, b}, plus {@code epsilons} random EPSILON transitions.
     */
    public static MachineDefinition randomDefinition(int randomSeed, int size, int epsilons) {
        final Random random = new Random(randomSeed);
        MachineDefinition base = AutomatonBridge.fromCompactNFA(generateNFA(random, size, 1.25f, 0.5f, AB));
        MachineDefinition.Builder builder = MachineDefinition.builder(ModelType.NFA).inputAlphabet(AB);
        for (State s : base.states()) {
            builder.addState(s);
        }
        builder.addTransitions(base.transitions());
        for (int i = 0; i < epsilons; i++) {
            String from = base.state(random.nextInt(size)).name();
            String to = base.state(random.nextInt(size)).name();
            builder.addTransition(Transition.epsilon(from, to));
        }
        return builder.build();
    }
}
