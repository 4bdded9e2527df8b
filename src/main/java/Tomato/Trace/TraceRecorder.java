package Tomato.Trace;

import java.util.List;

/**
 * Receives step events in the order they happen.
 */
public interface TraceRecorder {

    void record(StepEvent event);

    /**
     * @return the events kept so far; recorders that keep nothing return an empty list
     */
    default List<StepEvent> events() {
        return List.of();
    }
}
