package Tomato.Trace;

/**
 * Outcome of a run, or the outcome known so far while it is still going.
 */
public enum Verdict {
    RUNNING,
    ACCEPT,
    REJECT,
    /** The step limit was reached before the machine halted. */
    TIMEOUT,
    /** The driver stopped the run between two steps. */
    CANCELLED,
    /** A Mealy or Moore machine read its whole input. Transducers classify by output, not acceptance. */
    COMPLETE;

    public boolean isFinal() {
        return this != RUNNING;
    }
}
