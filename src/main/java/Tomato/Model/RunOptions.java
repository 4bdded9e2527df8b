package Tomato.Model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Per-run choices that the definition alone does not settle.
 */
public final class RunOptions {
    public static final int DEFAULT_MAX_STEPS = 10_000;

    /** How an NFA explores its choices. */
    public enum NfaMode {
        /** All active states advance together (subset stepping). */
        SUBSET,
        /** One path at a time, depth-first, in transition declaration order. */
        BACKTRACK
    }

    /** What makes a PDA accept once the input is exhausted. */
    public enum StackAcceptance {
        FINAL_STATE,
        EMPTY_STACK
    }

    /** When a Turing machine accepts. */
    public enum TuringAcceptance {
        /** Only once no transition applies, if the machine then sits in an accepting state. */
        HALT,
        /** As soon as the machine enters an accepting state. */
        STATE
    }

    private static final RunOptions DEFAULTS = builder().build();

    private final NfaMode nfaMode;
    private final Set<StackAcceptance> stackAcceptance;
    private final TuringAcceptance turingAcceptance;
    private final boolean moorePreOutput;
    private final int maxSteps;

    private RunOptions(Builder b) {
        this.nfaMode = b.nfaMode;
        this.stackAcceptance = Set.copyOf(b.stackAcceptance);
        this.turingAcceptance = b.turingAcceptance;
        this.moorePreOutput = b.moorePreOutput;
        this.maxSteps = b.maxSteps;
    }

    public static RunOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .nfaMode(nfaMode)
            .stackAcceptance(stackAcceptance)
            .turingAcceptance(turingAcceptance)
            .moorePreOutput(moorePreOutput)
            .maxSteps(maxSteps);
    }

    public NfaMode nfaMode() {
        return nfaMode;
    }

    public Set<StackAcceptance> stackAcceptance() {
        return stackAcceptance;
    }

    public boolean acceptsByFinalState() {
        return stackAcceptance.contains(StackAcceptance.FINAL_STATE);
    }

    public boolean acceptsByEmptyStack() {
        return stackAcceptance.contains(StackAcceptance.EMPTY_STACK);
    }

    public TuringAcceptance turingAcceptance() {
        return turingAcceptance;
    }

    /**
     * Whether a Moore machine emits the start state's output before reading any input.
     */
    public boolean moorePreOutput() {
        return moorePreOutput;
    }

    public int maxSteps() {
        return maxSteps;
    }

    @Override
    public String toString() {
        return "RunOptions[nfa=" + nfaMode + ", stack=" + stackAcceptance + ", turing=" + turingAcceptance
            + ", moorePreOutput=" + moorePreOutput + ", maxSteps=" + maxSteps + "]";
    }

    public static final class Builder {
        private NfaMode nfaMode = NfaMode.SUBSET;
        private Set<StackAcceptance> stackAcceptance = EnumSet.of(StackAcceptance.FINAL_STATE);
        private TuringAcceptance turingAcceptance = TuringAcceptance.HALT;
        private boolean moorePreOutput = true;
        private int maxSteps = DEFAULT_MAX_STEPS;

        private Builder() {
        }

        public Builder nfaMode(NfaMode mode) {
            this.nfaMode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        /**
         * Select one or both criteria. With both, the PDA accepts if either holds.
         */
        public Builder stackAcceptance(StackAcceptance first, StackAcceptance... rest) {
            return stackAcceptance(EnumSet.of(first, rest));
        }

        public Builder stackAcceptance(Set<StackAcceptance> criteria) {
            if (criteria.isEmpty()) {
                throw new IllegalArgumentException("At least one PDA acceptance criterion is required");
            }
            this.stackAcceptance = EnumSet.copyOf(criteria);
            return this;
        }

        public Builder turingAcceptance(TuringAcceptance acceptance) {
            this.turingAcceptance = Objects.requireNonNull(acceptance, "acceptance");
            return this;
        }

        public Builder moorePreOutput(boolean preOutput) {
            this.moorePreOutput = preOutput;
            return this;
        }

        public Builder maxSteps(int steps) {
            if (steps <= 0) {
                throw new IllegalArgumentException("maxSteps must be positive: " + steps);
            }
            this.maxSteps = steps;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(this);
        }
    }
}
