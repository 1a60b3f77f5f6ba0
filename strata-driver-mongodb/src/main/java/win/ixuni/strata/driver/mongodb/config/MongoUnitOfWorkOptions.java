package win.ixuni.strata.driver.mongodb.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import win.ixuni.strata.core.config.UnitOfWorkOptions;

import java.time.Duration;

/**
 * MongoDB driver options
 */
@Getter
@ToString(callSuper = true)
@SuperBuilder
public class MongoUnitOfWorkOptions extends UnitOfWorkOptions {

    /**
     * Either a plain server address ({@code host[:port]}) or a full connection string
     * ({@code mongodb://...}, {@code mongodb+srv://...})
     */
    @ToString.Exclude
    private final String connectionString;

    /**
     * Database name, qualified with the deployment environment
     */
    private final String databaseName;

    /**
     * How long to wait for a usable server before the connection is considered failed
     */
    @Builder.Default
    private final Duration serverSelectionTimeout = Duration.ofSeconds(30);
}
