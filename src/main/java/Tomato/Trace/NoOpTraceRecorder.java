package Tomato.Trace;

public class NoOpTraceRecorder implements TraceRecorder {
    public static final NoOpTraceRecorder INSTANCE = new NoOpTraceRecorder();

    @Override
    public void record(StepEvent event) {
    }

    @Override
    public String toString() {
        return "NoOp";
    }
}
