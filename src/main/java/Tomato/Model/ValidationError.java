package Tomato.Model;

/**
 * One reason why a definition cannot be simulated.
 */
public record ValidationError(Kind kind, String detail) {

    public enum Kind {
        NO_START_STATE,
        MULTIPLE_START_STATES,
        DANGLING_TRANSITION_REFERENCE,
        UNDECLARED_SYMBOL,
        /** Missing transition for some (state, symbol) pair of a DFA, Mealy or Moore machine. */
        INCOMPLETE_DFA,
        /** More than one transition for some (state, symbol) pair of a DFA, Mealy or Moore machine. */
        AMBIGUOUS_DFA,
        INVALID_PDA_POP,
        INVALID_TURING_MOVE,
        /** A sentinel symbol used where the model does not allow it. */
        ILLEGAL_EPSILON,
        MISSING_OUTPUT
    }

    @Override
    public String toString() {
        return kind + ": " + detail;
    }
}
