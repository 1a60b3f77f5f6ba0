package win.ixuni.strata.driver.mongodb.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.ServerAddress;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds client settings from the configured connection value
 * <p>
 * A plain {@code host[:port]} value is used as a single server address; anything else is parsed as a MongoDB
 * connection string. The address form is checked without throwing, so the fallback is an ordinary branch.
 */
public final class MongoConnectionSettings {

    private static final Pattern SERVER_ADDRESS =
            Pattern.compile("^([A-Za-z0-9._-]+|\\[[0-9A-Fa-f:.]+])(?::(\\d{1,5}))?$");

    private static final Pattern CREDENTIALS = Pattern.compile("//[^/@]*@");

    private MongoConnectionSettings() {
    }

    /**
     * Parse a plain server address
     *
     * @param value configured connection value
     * @return the address, empty when the value is not of the {@code host[:port]} form
     */
    public static Optional<ServerAddress> parseServerAddress(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher matcher = SERVER_ADDRESS.matcher(value.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String host = matcher.group(1);
        if (matcher.group(2) == null) {
            return Optional.of(new ServerAddress(host));
        }
        int port = Integer.parseInt(matcher.group(2));
        if (port < 1 || port > 65535) {
            return Optional.empty();
        }
        return Optional.of(new ServerAddress(host, port));
    }

    /**
     * Client settings for the configured connection, address form first
     */
    public static MongoClientSettings build(MongoUnitOfWorkOptions options) {
        long timeoutMillis = options.getServerSelectionTimeout().toMillis();
        MongoClientSettings.Builder builder = MongoClientSettings.builder();

        Optional<ServerAddress> address = parseServerAddress(options.getConnectionString());
        if (address.isPresent()) {
            builder.applyToClusterSettings(cluster -> cluster
                    .hosts(List.of(address.get()))
                    .serverSelectionTimeout(timeoutMillis, TimeUnit.MILLISECONDS));
        } else {
            builder.applyConnectionString(new ConnectionString(options.getConnectionString()))
                    .applyToClusterSettings(cluster -> cluster
                            .serverSelectionTimeout(timeoutMillis, TimeUnit.MILLISECONDS));
        }
        return builder.build();
    }

    /**
     * Connection value with credentials masked, for logging
     */
    public static String redact(String connectionString) {
        if (connectionString == null) {
            return null;
        }
        return CREDENTIALS.matcher(connectionString).replaceFirst("//***@");
    }
}
