package Tomato.Index;

import Tomato.Model.MachineDefinition;
import Tomato.Model.ModelType;
import Tomato.Model.Symbol;
import Tomato.Model.Transition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Transitions grouped by lookup key {@code (state, read[, extra])}. Lists keep declaration order,
 * which is the order nondeterministic choices are tried in.
 * For PDAs {@code extra} is the pop symbol; other models have no extra part.
 */
public final class TransitionIndex {
    private final MachineDefinition definition;
    private final Map<Key, List<Transition>> byKey = new HashMap<>();
    private final Map<Key, List<Transition>> byRead = new HashMap<>();
    private final List<List<Transition>> outgoing;

    private TransitionIndex(MachineDefinition definition) {
        this.definition = definition;
        this.outgoing = new ArrayList<>(definition.size());
        for (int i = 0; i < definition.size(); i++) {
            outgoing.add(new ArrayList<>());
        }
        List<Transition> all = definition.transitions();
        boolean pushdown = definition.type() == ModelType.PDA;
        for (Transition t : all) {
            int from = definition.stateId(t.from());
            if (from == MachineDefinition.MISSING_STATE) {
                continue;
            }
            Symbol extra = pushdown ? t.pop() : null;
            byKey.computeIfAbsent(new Key(from, t.read(), extra), k -> new ArrayList<>(1)).add(t);
            byRead.computeIfAbsent(new Key(from, t.read(), null), k -> new ArrayList<>(1)).add(t);
            outgoing.get(from).add(t);
        }
        // shared by every run on the definition
        byKey.replaceAll((k, v) -> Collections.unmodifiableList(v));
        byRead.replaceAll((k, v) -> Collections.unmodifiableList(v));
        outgoing.replaceAll(Collections::unmodifiableList);
    }

    /**
     * Prefer {@link TransitionIndexes#of(MachineDefinition)}, which caches the result.
     */
    public static TransitionIndex build(MachineDefinition definition) {
        return new TransitionIndex(definition);
    }

    public MachineDefinition definition() {
        return definition;
    }

    /**
     * @return transitions leaving {@code state} on {@code read}, whatever their extra part
     */
    public List<Transition> lookup(int state, Symbol read) {
        return byRead.getOrDefault(new Key(state, read, null), Collections.emptyList());
    }

    /**
     * @return transitions leaving {@code state} on {@code read} whose extra part is {@code extra}
     */
    public List<Transition> lookup(int state, Symbol read, Symbol extra) {
        return byKey.getOrDefault(new Key(state, read, extra), Collections.emptyList());
    }

    /**
     * @return the first matching transition, or null
     */
    public Transition first(int state, Symbol read) {
        List<Transition> found = lookup(state, read);
        return found.isEmpty() ? null : found.get(0);
    }

    public List<Transition> outgoing(int state) {
        return outgoing.get(state);
    }

    /**
     * @return id of the transition's target state
     */
    public int target(Transition t) {
        return definition.stateId(t.to());
    }

    /**
     * Set of states reachable from {@code states} through EPSILON transitions, the states themselves included.
     * EPSILON cycles are fine: each state is expanded once.
     */
    public BitSet epsilonClosure(BitSet states) {
        BitSet closure = (BitSet) states.clone();
        Deque<Integer> stack = new ArrayDeque<>();
        for (int i = states.nextSetBit(0); i >= 0; i = states.nextSetBit(i + 1)) {
            stack.push(i);
        }
        while (!stack.isEmpty()) {
            int s = stack.pop();
            for (Transition t : lookup(s, Symbol.EPSILON)) {
                int next = target(t);
                if (!closure.get(next)) {
                    closure.set(next);
                    stack.push(next);
                }
            }
        }
        return closure;
    }

    /**
     * States reached from {@code states} by reading {@code symbol}, without closing over EPSILON.
     */
    public BitSet move(BitSet states, Symbol symbol) {
        BitSet result = new BitSet(definition.size());
        for (int i = states.nextSetBit(0); i >= 0; i = states.nextSetBit(i + 1)) {
            for (Transition t : lookup(i, symbol)) {
                result.set(target(t));
            }
        }
        return result;
    }

    public int keyCount() {
        return byKey.size();
    }

    @Override
    public String toString() {
        return "TransitionIndex[" + definition.type() + ", keys=" + byKey.size() + "]";
    }

    private record Key(int state, Symbol read, Symbol extra) { }
}
