package Tomato.Convert;

import Tomato.Index.TransitionIndex;
import Tomato.Index.TransitionIndexes;
import Tomato.Model.MachineDefinition;
import Tomato.Model.MachineValidator;
import Tomato.Model.ModelType;
import Tomato.Model.Symbol;
import Tomato.Model.Transition;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Right-linear grammar generating the language of a DFA or NFA. Non-terminals are the state names.
 * <p>
 * For every state {@code p} and every symbol transition {@code r -a-> q} with {@code r} in the
 * EPSILON closure of {@code p} there is a production {@code p -> a q}, plus {@code p -> a} if
 * {@code q} is accepting. {@code p -> ε} exists if the closure of {@code p} holds an accepting state.
 */
public final class RegularGrammar {
    private final String start;
    private final Map<String, List<Production>> productions;

    /**
     * @param terminal null for the empty word
     * @param next     null if the production ends the derivation
     */
    public record Production(Symbol terminal, String next) {
        public static final Production EMPTY = new Production(null, null);

        public boolean isEmptyWord() {
            return terminal == null;
        }

        @Override
        public String toString() {
            if (terminal == null) {
                return Symbol.EPSILON.text();
            }
            return next == null ? terminal.text() : terminal.text() + " " + next;
        }
    }

    private RegularGrammar(String start, Map<String, List<Production>> productions) {
        this.start = start;
        this.productions = productions;
    }

    public static RegularGrammar of(MachineDefinition definition) {
        if (definition.type() != ModelType.DFA && definition.type() != ModelType.NFA) {
            throw new IllegalArgumentException("Expected a DFA or NFA, got " + definition.type());
        }
        MachineValidator.validate(definition);
        TransitionIndex index = TransitionIndexes.of(definition);

        Map<String, List<Production>> productions = new LinkedHashMap<>();
        for (int p = 0; p < definition.size(); p++) {
            BitSet single = new BitSet();
            single.set(p);
            BitSet closure = index.epsilonClosure(single);

            Set<Production> rhs = new LinkedHashSet<>();
            for (int r = closure.nextSetBit(0); r >= 0; r = closure.nextSetBit(r + 1)) {
                if (definition.isAccepting(r)) {
                    rhs.add(Production.EMPTY);
                    break;
                }
            }
            for (int r = closure.nextSetBit(0); r >= 0; r = closure.nextSetBit(r + 1)) {
                for (Transition t : index.outgoing(r)) {
                    if (t.isEpsilon()) {
                        continue;
                    }
                    rhs.add(new Production(t.read(), t.to()));
                    if (definition.isAccepting(index.target(t))) {
                        rhs.add(new Production(t.read(), null));
                    }
                }
            }
            if (!rhs.isEmpty()) {
                productions.put(definition.state(p).name(), List.copyOf(rhs));
            }
        }
        return new RegularGrammar(definition.startState().name(), Collections.unmodifiableMap(productions));
    }

    public String start() {
        return start;
    }

    /**
     * @return non-terminals with at least one production, in state declaration order
     */
    public Set<String> nonTerminals() {
        return productions.keySet();
    }

    public List<Production> productions(String nonTerminal) {
        return productions.getOrDefault(nonTerminal, List.of());
    }

    @Override
    public String toString() {
        List<String> lines = new ArrayList<>();
        lines.add("S = " + start);
        lines.add("");
        for (Map.Entry<String, List<Production>> e : productions.entrySet()) {
            String rhs = e.getValue().stream().map(Production::toString).collect(Collectors.joining(" | "));
            lines.add(e.getKey() + " -> " + rhs);
        }
        return String.join("\n", lines);
    }
}
