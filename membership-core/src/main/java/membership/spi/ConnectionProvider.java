package membership.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies JDBC connections to the store implementations.
 *
 * <p>Callers close the connection when done.
 */
@FunctionalInterface
public interface ConnectionProvider {

    Connection getConnection() throws SQLException;
}
