package Tomato.Trace;

import Tomato.Model.Transition;

/**
 * One step of a run, in the order the engine produced it.
 *
 * @param branchId    branch the step belongs to; 0 for the first branch and for deterministic runs
 * @param kind        what happened
 * @param before      configuration the step started from, null for the very first event of a search
 * @param transition  transition applied, null when the step applied none (halting, subset stepping)
 * @param after       configuration reached; equals {@code before} when nothing was applied
 * @param verdict     verdict known after this step
 */
public record StepEvent(int branchId, StepKind kind, Configuration before, Transition transition,
                        Configuration after, Verdict verdict) {

    public boolean isDeadBranch() {
        return kind == StepKind.DEAD_BRANCH;
    }

    @Override
    public String toString() {
        return "#" + branchId + " " + kind + " " + before + (transition == null ? "" : " [" + transition + "]")
            + " => " + after + " (" + verdict + ")";
    }
}
