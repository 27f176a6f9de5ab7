package membership.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.h2.tools.RunScript;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.util.UUID;

/**
 * Creates an in-memory H2 database with the bundled schema.
 */
final class H2Schema {

  private H2Schema() {}

  static JdbcDataSource newDataSource() throws Exception {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    try (InputStream in = H2Schema.class.getClassLoader().getResourceAsStream("membership/schema.sql");
         Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
         Connection conn = dataSource.getConnection()) {
      RunScript.execute(conn, reader);
    }
    return dataSource;
  }
}
