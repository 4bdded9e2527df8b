package Tomato.Model;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable description of a machine: states, transitions, alphabets and per-model extras.
 * <p>
 * States are numbered densely in declaration order; engines work on these ids.
 * Building a definition does not validate it, see {@link MachineValidator}.
 */
public final class MachineDefinition {
    public static final int MISSING_STATE = -1;

    private final ModelType type;
    private final List<State> states;
    private final Object2IntMap<String> stateIds;
    private final List<Transition> transitions;
    private final Alphabet<Symbol> inputAlphabet;
    private final Alphabet<Symbol> outputAlphabet;
    private final Alphabet<Symbol> stackAlphabet;
    private final Alphabet<Symbol> tapeAlphabet;
    private final Symbol initialStackSymbol;
    private final Symbol blankSymbol;

    private MachineDefinition(Builder b) {
        this.type = b.type;
        this.states = List.copyOf(b.states);
        this.stateIds = new Object2IntOpenHashMap<>(states.size());
        this.stateIds.defaultReturnValue(MISSING_STATE);
        for (int i = 0; i < states.size(); i++) {
            stateIds.put(states.get(i).name(), i);
        }
        this.transitions = List.copyOf(b.transitions);
        this.initialStackSymbol = b.initialStackSymbol;
        this.blankSymbol = b.blankSymbol;

        this.inputAlphabet = Alphabets.fromCollection(b.inputAlphabet != null ? b.inputAlphabet : inferInputs());
        this.outputAlphabet = Alphabets.fromCollection(b.outputAlphabet != null ? b.outputAlphabet : inferOutputs());
        this.stackAlphabet = Alphabets.fromCollection(b.stackAlphabet != null ? b.stackAlphabet : inferStack());
        this.tapeAlphabet = Alphabets.fromCollection(b.tapeAlphabet != null ? b.tapeAlphabet : inferTape());
    }

    public static Builder builder(ModelType type) {
        return new Builder(type);
    }

    public ModelType type() {
        return type;
    }

    public List<State> states() {
        return states;
    }

    public int size() {
        return states.size();
    }

    public List<Transition> transitions() {
        return transitions;
    }

    public Alphabet<Symbol> inputAlphabet() {
        return inputAlphabet;
    }

    public Alphabet<Symbol> outputAlphabet() {
        return outputAlphabet;
    }

    public Alphabet<Symbol> stackAlphabet() {
        return stackAlphabet;
    }

    public Alphabet<Symbol> tapeAlphabet() {
        return tapeAlphabet;
    }

    /**
     * Symbol on the stack before a PDA run starts, or null for an initially empty stack.
     */
    public Symbol initialStackSymbol() {
        return initialStackSymbol;
    }

    public Symbol blankSymbol() {
        return blankSymbol;
    }

    /**
     * @return id of the state, or {@link #MISSING_STATE}
     */
    public int stateId(String name) {
        return stateIds.getInt(name);
    }

    public State state(int id) {
        return states.get(id);
    }

    public boolean hasState(String name) {
        return stateIds.containsKey(name);
    }

    public boolean isAccepting(int id) {
        return states.get(id).accepting();
    }

    public List<State> startStates() {
        return states.stream().filter(State::start).collect(Collectors.toList());
    }

    /**
     * @return the unique start state; only meaningful on a validated definition
     */
    public State startState() {
        for (State s : states) {
            if (s.start()) {
                return s;
            }
        }
        return null;
    }

    public Set<String> acceptingStates() {
        Set<String> result = new LinkedHashSet<>();
        for (State s : states) {
            if (s.accepting()) {
                result.add(s.name());
            }
        }
        return result;
    }

    private Set<Symbol> inferInputs() {
        if (type == ModelType.TURING) {
            return inferTape();
        }
        Set<Symbol> result = new LinkedHashSet<>();
        for (Transition t : transitions) {
            addOrdinary(result, t.read());
        }
        return result;
    }

    private Set<Symbol> inferOutputs() {
        Set<Symbol> result = new LinkedHashSet<>();
        for (State s : states) {
            addOrdinary(result, s.output());
        }
        for (Transition t : transitions) {
            addOrdinary(result, t.output());
        }
        return result;
    }

    private Set<Symbol> inferStack() {
        Set<Symbol> result = new LinkedHashSet<>();
        addOrdinary(result, initialStackSymbol);
        for (Transition t : transitions) {
            addOrdinary(result, t.pop());
            t.push().forEach(s -> addOrdinary(result, s));
        }
        return result;
    }

    private Set<Symbol> inferTape() {
        Set<Symbol> result = new LinkedHashSet<>();
        for (Transition t : transitions) {
            addOrdinary(result, t.read());
            addOrdinary(result, t.write());
        }
        return result;
    }

    private static void addOrdinary(Set<Symbol> target, Symbol s) {
        if (s != null && !s.isSentinel()) {
            target.add(s);
        }
    }

    @Override
    public String toString() {
        return type + "[states=" + states + ", transitions=" + transitions.size() + "]";
    }

    /**
     * Collects states and transitions in declaration order. Declaration order of transitions is
     * the order in which nondeterministic choices are explored.
     * Alphabets that are not declared explicitly are inferred from the transitions.
     */
    public static final class Builder {
        private final ModelType type;
        private final List<State> states = new ArrayList<>();
        private final Set<String> names = new LinkedHashSet<>();
        private final List<Transition> transitions = new ArrayList<>();
        private Set<Symbol> inputAlphabet;
        private Set<Symbol> outputAlphabet;
        private Set<Symbol> stackAlphabet;
        private Set<Symbol> tapeAlphabet;
        private Symbol initialStackSymbol;
        private Symbol blankSymbol = Symbol.BLANK;

        private Builder(ModelType type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder addState(String name, boolean start, boolean accepting) {
            return addState(new State(name, start, accepting, null));
        }

        public Builder addState(String name) {
            return addState(name, false, false);
        }

        public Builder addMooreState(String name, boolean start, Symbol output) {
            return addState(new State(name, start, false, output));
        }

        public Builder addState(State state) {
            if (!names.add(state.name())) {
                throw new IllegalArgumentException("State '" + state.name() + "' is already declared");
            }
            states.add(state);
            return this;
        }

        public Builder addTransition(Transition transition) {
            transitions.add(Objects.requireNonNull(transition, "transition"));
            return this;
        }

        public Builder addTransition(String from, String read, String to) {
            return addTransition(Transition.of(from, Symbol.of(read), to));
        }

        public Builder addTransitions(Collection<Transition> all) {
            all.forEach(this::addTransition);
            return this;
        }

        public Builder inputAlphabet(Collection<Symbol> symbols) {
            this.inputAlphabet = new LinkedHashSet<>(symbols);
            return this;
        }

        public Builder inputAlphabet(String... symbols) {
            return inputAlphabet(toSymbols(symbols));
        }

        public Builder outputAlphabet(Collection<Symbol> symbols) {
            this.outputAlphabet = new LinkedHashSet<>(symbols);
            return this;
        }

        public Builder outputAlphabet(String... symbols) {
            return outputAlphabet(toSymbols(symbols));
        }

        public Builder stackAlphabet(Collection<Symbol> symbols) {
            this.stackAlphabet = new LinkedHashSet<>(symbols);
            return this;
        }

        public Builder stackAlphabet(String... symbols) {
            return stackAlphabet(toSymbols(symbols));
        }

        public Builder tapeAlphabet(Collection<Symbol> symbols) {
            this.tapeAlphabet = new LinkedHashSet<>(symbols);
            return this;
        }

        public Builder tapeAlphabet(String... symbols) {
            return tapeAlphabet(toSymbols(symbols));
        }

        public Builder initialStackSymbol(Symbol symbol) {
            this.initialStackSymbol = symbol;
            return this;
        }

        public Builder blankSymbol(Symbol symbol) {
            this.blankSymbol = Objects.requireNonNull(symbol, "blankSymbol");
            return this;
        }

        public MachineDefinition build() {
            return new MachineDefinition(this);
        }

        private static List<Symbol> toSymbols(String... symbols) {
            if (symbols.length == 0) {
                return Collections.emptyList();
            }
            return Arrays.stream(symbols).map(Symbol::of).collect(Collectors.toList());
        }
    }
}
