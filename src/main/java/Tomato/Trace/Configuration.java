package Tomato.Trace;

import java.util.Set;

/**
 * Snapshot of a machine during a run. Values are immutable and owned by the run that made them.
 */
public interface Configuration {

    /**
     * @return the active state names; a single state except in NFA subset stepping
     */
    Set<String> states();
}
