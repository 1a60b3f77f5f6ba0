package win.ixuni.strata.core.pipeline;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.slf4j.Logger;
import win.ixuni.strata.core.cache.EntityCache;

import java.time.Clock;

/**
 * Parameters of the collection pipeline
 */
@Value
@Builder
public class PipelineSettings {

    /**
     * Shared entity cache, may be null when caching is disabled
     */
    EntityCache cache;

    @Builder.Default
    boolean cacheEnabled = true;

    /**
     * Actor id recorded on writes
     */
    String actorId;

    @Builder.Default
    boolean logTime = false;

    /**
     * Logger that receives timing entries
     */
    @NonNull
    Logger logger;

    @Builder.Default
    Clock clock = Clock.systemUTC();

    /**
     * Transaction state check run before every operation, null for none
     */
    Runnable stateCheck;
}
