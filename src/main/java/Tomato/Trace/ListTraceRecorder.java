package Tomato.Trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ListTraceRecorder implements TraceRecorder {
    private final List<StepEvent> events = new ArrayList<>();

    @Override
    public void record(StepEvent event) {
        events.add(event);
    }

    @Override
    public List<StepEvent> events() {
        return Collections.unmodifiableList(events);
    }

    public StepEvent last() {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    public void clear() {
        events.clear();
    }

    @Override
    public String toString() {
        return "List(" + events.size() + ")";
    }
}
