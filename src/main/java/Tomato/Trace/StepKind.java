package Tomato.Trace;

public enum StepKind {
    /** A transition (or, in subset stepping, a whole input symbol) was applied and the run continues. */
    MOVE,
    /**
     * The branch ended without acceptance: no transition applies, its configuration was explored
     * already, or a required pop found the stack empty.
     */
    DEAD_BRANCH,
    /** The run is over; the event carries the final verdict. */
    HALT
}
