package Tomato.Model;

import static Tomato.Model.ValidationError.Kind.AMBIGUOUS_DFA;
import static Tomato.Model.ValidationError.Kind.DANGLING_TRANSITION_REFERENCE;
import static Tomato.Model.ValidationError.Kind.ILLEGAL_EPSILON;
import static Tomato.Model.ValidationError.Kind.INCOMPLETE_DFA;
import static Tomato.Model.ValidationError.Kind.INVALID_PDA_POP;
import static Tomato.Model.ValidationError.Kind.INVALID_TURING_MOVE;
import static Tomato.Model.ValidationError.Kind.MISSING_OUTPUT;
import static Tomato.Model.ValidationError.Kind.MULTIPLE_START_STATES;
import static Tomato.Model.ValidationError.Kind.NO_START_STATE;
import static Tomato.Model.ValidationError.Kind.UNDECLARED_SYMBOL;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import net.automatalib.alphabet.Alphabet;

/**
 * Structural checks run once before simulation. Engines rely on them and never re-check mid-run.
 */
public final class MachineValidator {

    private MachineValidator() {
    }

    /**
     * @throws InvalidMachineException listing every problem, if there is any
     */
    public static void validate(MachineDefinition definition) {
        List<ValidationError> errors = check(definition);
        if (!errors.isEmpty()) {
            throw new InvalidMachineException(errors);
        }
    }

    public static boolean isValid(MachineDefinition definition) {
        return check(definition).isEmpty();
    }

    /**
     * @return all problems found, in a stable order; empty if the definition is valid
     */
    public static List<ValidationError> check(MachineDefinition definition) {
        List<ValidationError> errors = new ArrayList<>();
        checkStartStates(definition, errors);
        checkStates(definition, errors);
        for (Transition t : definition.transitions()) {
            checkReferences(definition, t, errors);
            checkRead(definition, t, errors);
            switch (definition.type()) {
                case MEALY -> checkMealy(definition, t, errors);
                case PDA -> checkPda(definition, t, errors);
                case TURING -> checkTuring(definition, t, errors);
                default -> { }
            }
        }
        if (definition.type().requiresTotalFunction()) {
            checkTotalFunction(definition, errors);
        }
        return errors;
    }

    private static void checkStartStates(MachineDefinition definition, List<ValidationError> errors) {
        List<State> starts = definition.startStates();
        if (starts.isEmpty()) {
            errors.add(new ValidationError(NO_START_STATE, "no state is marked as start state"));
        } else if (starts.size() > 1) {
            String names = starts.stream().map(State::name).collect(Collectors.joining(", "));
            errors.add(new ValidationError(MULTIPLE_START_STATES, "start states: " + names));
        }
    }

    private static void checkStates(MachineDefinition definition, List<ValidationError> errors) {
        if (definition.type() == ModelType.MOORE) {
            for (State s : definition.states()) {
                if (s.output() == null) {
                    errors.add(new ValidationError(MISSING_OUTPUT, "Moore state " + s.name() + " has no output"));
                } else if (s.output().isSentinel()) {
                    errors.add(new ValidationError(ILLEGAL_EPSILON, "Moore state " + s.name() + " outputs " + s.output()));
                } else if (!definition.outputAlphabet().containsSymbol(s.output())) {
                    errors.add(undeclared("output", s.output(), "state " + s.name()));
                }
            }
        }
        if (definition.type() == ModelType.PDA && definition.initialStackSymbol() != null) {
            Symbol bottom = definition.initialStackSymbol();
            if (bottom.isSentinel() || !definition.stackAlphabet().containsSymbol(bottom)) {
                errors.add(undeclared("stack", bottom, "initial stack symbol"));
            }
        }
    }

    private static void checkReferences(MachineDefinition definition, Transition t, List<ValidationError> errors) {
        if (!definition.hasState(t.from())) {
            errors.add(new ValidationError(DANGLING_TRANSITION_REFERENCE, t + ": unknown source state " + t.from()));
        }
        if (!definition.hasState(t.to())) {
            errors.add(new ValidationError(DANGLING_TRANSITION_REFERENCE, t + ": unknown target state " + t.to()));
        }
    }

    private static void checkRead(MachineDefinition definition, Transition t, List<ValidationError> errors) {
        Symbol read = t.read();
        ModelType type = definition.type();
        if (read.isEpsilon()) {
            if (!type.allowsEpsilonInput()) {
                errors.add(new ValidationError(ILLEGAL_EPSILON, t + ": " + type + " transitions must read a symbol"));
            }
            return;
        }
        if (type == ModelType.TURING) {
            if (!isTapeSymbol(definition, read)) {
                errors.add(undeclared("tape", read, t.toString()));
            }
            return;
        }
        if (read.isBlank()) {
            errors.add(new ValidationError(ILLEGAL_EPSILON, t + ": the blank symbol only exists on Turing tapes"));
        } else if (!definition.inputAlphabet().containsSymbol(read)) {
            errors.add(undeclared("input", read, t.toString()));
        }
    }

    private static void checkMealy(MachineDefinition definition, Transition t, List<ValidationError> errors) {
        if (t.output() == null) {
            errors.add(new ValidationError(MISSING_OUTPUT, t + ": Mealy transitions must emit a symbol"));
        } else if (t.output().isSentinel()) {
            errors.add(new ValidationError(ILLEGAL_EPSILON, t + ": cannot emit " + t.output()));
        } else if (!definition.outputAlphabet().containsSymbol(t.output())) {
            errors.add(undeclared("output", t.output(), t.toString()));
        }
    }

    private static void checkPda(MachineDefinition definition, Transition t, List<ValidationError> errors) {
        Alphabet<Symbol> stack = definition.stackAlphabet();
        Symbol pop = t.pop();
        if (pop == null || pop.isBlank() || (!pop.isEpsilon() && !stack.containsSymbol(pop))) {
            errors.add(new ValidationError(INVALID_PDA_POP, t + ": pop symbol " + pop + " is not on the stack alphabet"));
        }
        for (Symbol pushed : t.push()) {
            if (pushed.isSentinel()) {
                errors.add(new ValidationError(ILLEGAL_EPSILON, t + ": cannot push " + pushed));
            } else if (!stack.containsSymbol(pushed)) {
                errors.add(undeclared("stack", pushed, t.toString()));
            }
        }
    }

    private static void checkTuring(MachineDefinition definition, Transition t, List<ValidationError> errors) {
        if (t.move() == null) {
            errors.add(new ValidationError(INVALID_TURING_MOVE, t + ": missing head movement"));
        }
        if (t.write() == null || t.write().isEpsilon()) {
            errors.add(new ValidationError(INVALID_TURING_MOVE, t + ": missing symbol to write"));
        } else if (!isTapeSymbol(definition, t.write())) {
            errors.add(undeclared("tape", t.write(), t.toString()));
        }
    }

    private static void checkTotalFunction(MachineDefinition definition, List<ValidationError> errors) {
        Alphabet<Symbol> inputs = definition.inputAlphabet();
        int[][] counts = new int[definition.size()][inputs.size()];
        for (Transition t : definition.transitions()) {
            int from = definition.stateId(t.from());
            if (from == MachineDefinition.MISSING_STATE || !definition.hasState(t.to())
                || t.read().isSentinel() || !inputs.containsSymbol(t.read())) {
                continue; // reported already
            }
            counts[from][inputs.getSymbolIndex(t.read())]++;
        }
        for (int s = 0; s < counts.length; s++) {
            for (int a = 0; a < inputs.size(); a++) {
                String pair = "(" + definition.state(s).name() + ", " + inputs.getSymbol(a) + ")";
                if (counts[s][a] == 0) {
                    errors.add(new ValidationError(INCOMPLETE_DFA, "no transition for " + pair));
                } else if (counts[s][a] > 1) {
                    errors.add(new ValidationError(AMBIGUOUS_DFA, counts[s][a] + " transitions for " + pair));
                }
            }
        }
    }

    private static boolean isTapeSymbol(MachineDefinition definition, Symbol s) {
        return s.equals(definition.blankSymbol()) || definition.tapeAlphabet().containsSymbol(s);
    }

    private static ValidationError undeclared(String alphabet, Symbol symbol, String where) {
        return new ValidationError(UNDECLARED_SYMBOL, where + ": " + symbol + " is not in the " + alphabet + " alphabet");
    }
}
