package win.ixuni.strata.core.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Options shared by every unit-of-work implementation
 * <p>
 * Drivers extend this class with their connection settings and reject options of any other variant.
 */
@Getter
@ToString
@SuperBuilder
public class UnitOfWorkOptions {

    /**
     * Identity attributed to mutations
     */
    private final String actorId;

    /**
     * Log the elapsed time of every collection operation
     */
    @Builder.Default
    private final boolean logTime = false;

    /**
     * Whether reads by id go through the entity cache
     */
    @Builder.Default
    private final boolean cacheEnabled = true;

    /**
     * Deployment qualifier; blank means {@value EnvironmentQualifier#DEFAULT}
     */
    private final String environment;

    @Builder.Default
    private final CommitRetrySettings commitRetry = CommitRetrySettings.defaults();

    public String getQualifier() {
        return EnvironmentQualifier.resolve(environment);
    }
}
