package bulkmail.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs the reference DDL shipped under {@code schema/<store>.sql}.
 *
 * <p>Intended for demos and tests; production schemas belong to the application's
 * migration tool. Statements are separated by {@code ;} and lines starting with
 * {@code --} are ignored.
 */
public final class SchemaScripts {
  private static final Logger logger = Logger.getLogger(SchemaScripts.class.getName());

  private SchemaScripts() {}

  /**
   * Executes the script for the given store name ({@code h2}, {@code mysql} or {@code postgresql}).
   *
   * @return the number of statements executed
   */
  public static int apply(Connection conn, String storeName) throws SQLException {
    Objects.requireNonNull(conn, "conn");
    List<String> statements = statements(storeName);
    try (Statement stmt = conn.createStatement()) {
      for (String sql : statements) {
        stmt.execute(sql);
      }
    }
    logger.fine(() -> "Applied " + statements.size() + " schema statements for " + storeName);
    return statements.size();
  }

  /**
   * Returns the statements of the script for the given store name.
   *
   * @throws IllegalArgumentException if no script exists for the name
   */
  public static List<String> statements(String storeName) {
    Objects.requireNonNull(storeName, "storeName");
    String resource = "schema/" + storeName + ".sql";
    try (InputStream in = SchemaScripts.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No schema script for store: " + storeName);
      }
      return split(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
  }

  static List<String> split(String script) {
    StringBuilder current = new StringBuilder();
    List<String> result = new ArrayList<>();
    for (String line : script.split("\n")) {
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("--")) {
        continue;
      }
      current.append(trimmed).append(' ');
      if (trimmed.endsWith(";")) {
        String sql = current.toString().trim();
        result.add(sql.substring(0, sql.length() - 1).trim());
        current.setLength(0);
      }
    }
    if (!current.toString().isBlank()) {
      result.add(current.toString().trim());
    }
    return result;
  }
}
