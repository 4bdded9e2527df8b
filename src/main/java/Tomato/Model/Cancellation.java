package Tomato.Model;

/**
 * Stops a run between two steps, either because the driver asked for it or because the run went
 * past its step budget.
 */
public class Cancellation {

    private final int stepThreshold;

    private volatile boolean interrupted;
    private boolean timedOut;

    public Cancellation(int stepThreshold) {
        this.stepThreshold = stepThreshold;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    public void setInterrupted() {
        this.interrupted = true;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public int getStepThreshold() {
        return stepThreshold;
    }

    public boolean isAboveThreshold(int steps) {
        this.timedOut |= steps >= stepThreshold;
        return this.timedOut;
    }
}
