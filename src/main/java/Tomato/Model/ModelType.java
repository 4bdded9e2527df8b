package Tomato.Model;

/**
 * The machine families the engine can simulate.
 */
public enum ModelType {
    DFA(true),
    NFA(false),
    MEALY(true),
    MOORE(true),
    PDA(false),
    TURING(false);

    private final boolean deterministic;

    ModelType(boolean deterministic) {
        this.deterministic = deterministic;
    }

    /**
     * Whether every (state, input symbol) pair must have exactly one transition.
     */
    public boolean requiresTotalFunction() {
        return deterministic;
    }

    public boolean allowsEpsilonInput() {
        return this == NFA || this == PDA;
    }
}
