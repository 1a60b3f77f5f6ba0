package win.ixuni.strata.core.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Retry policy for commits whose outcome the store could not confirm
 * <p>
 * Retries back off exponentially from {@code minBackoff} up to {@code maxBackoff}.
 */
@Value
@Builder(toBuilder = true)
public class CommitRetrySettings {

    /**
     * Maximum number of retries, the first attempt not included
     */
    @Builder.Default
    long maxRetries = 10;

    @Builder.Default
    Duration minBackoff = Duration.ofMillis(100);

    @Builder.Default
    Duration maxBackoff = Duration.ofSeconds(5);

    public static CommitRetrySettings defaults() {
        return CommitRetrySettings.builder().build();
    }

    /**
     * Keep retrying for as long as the outcome stays unknown
     * <p>
     * A store that never confirms stalls the committing caller indefinitely.
     */
    public static CommitRetrySettings unbounded() {
        return CommitRetrySettings.builder().maxRetries(Long.MAX_VALUE).build();
    }
}
