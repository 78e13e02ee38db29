package eu.okaeri.cellstore.jdbc.commons;

import com.zaxxer.hikari.HikariConfig;
import lombok.NonNull;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

public final class JdbcHelper {

    private static final Logger LOGGER = Logger.getLogger(JdbcHelper.class.getSimpleName());
    private static final Pattern SAFE_NAME = Pattern.compile("^[a-zA-Z0-9_]+$");

    private JdbcHelper() {
    }

    public static void initDriver(@NonNull String clazz) {
        try {
            Class.forName(clazz);
        } catch (ClassNotFoundException exception) {
            LOGGER.warning("Driver " + clazz + " not found, relying on DriverManager discovery");
        }
    }

    public static HikariConfig configureHikari(@NonNull String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        return config;
    }

    public static HikariConfig configureHikari(@NonNull String jdbcUrl, @NonNull String driverClazz) {
        initDriver(driverClazz);
        return configureHikari(jdbcUrl);
    }

    /**
     * Double-quoted SQL identifier. Only letters, digits and underscores are accepted.
     */
    public static String quote(@NonNull String identifier) {
        if (!SAFE_NAME.matcher(identifier).matches()) {
            throw new IllegalArgumentException("identifier '" + identifier + "' cannot be used as sql identifier");
        }
        return "\"" + identifier + "\"";
    }

    public static boolean isSafeName(String name) {
        return (name != null) && SAFE_NAME.matcher(name).matches();
    }

    /**
     * Roll back after a failed write. A rollback failure is attached to the original error.
     */
    public static void rollback(@NonNull Connection connection, @NonNull Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackException) {
            LOGGER.log(Level.SEVERE, "Rollback failed", rollbackException);
            cause.addSuppressed(rollbackException);
        }
    }
}
