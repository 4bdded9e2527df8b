package Tomato.Index;

import Tomato.Model.MachineDefinition;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one index per definition instance. Definitions are immutable, so an index never goes stale;
 * an edited machine is a new definition and gets a new index.
 */
public final class TransitionIndexes {
    private static final Logger LOG = LoggerFactory.getLogger(TransitionIndexes.class);
    private static final int MAX_CACHED = 256;

    // definitions use identity equality, so equal machines built twice get separate entries
    private static final Cache<MachineDefinition, TransitionIndex> CACHE = Caffeine.newBuilder()
        .maximumSize(MAX_CACHED)
        .executor(Runnable::run) // evict on the calling thread
        .build();

    private TransitionIndexes() {
    }

    public static TransitionIndex of(MachineDefinition definition) {
        return CACHE.get(definition, d -> {
            TransitionIndex index = TransitionIndex.build(d);
            LOG.debug("Built {} for {} states", index, d.size());
            return index;
        });
    }

    static void invalidate(MachineDefinition definition) {
        CACHE.invalidate(definition);
    }

    static long cachedCount() {
        CACHE.cleanUp();
        return CACHE.estimatedSize();
    }
}
