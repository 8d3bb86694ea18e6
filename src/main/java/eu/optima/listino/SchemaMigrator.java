package eu.optima.listino;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.stream.Collectors;

/** Applies schema.sql (mapping store tables). */
public class SchemaMigrator {

  public static void main(String[] args) throws Exception {
    String url  = System.getenv("PG_URL");
    String user = System.getenv("PG_USER");
    String pass = System.getenv("PG_PASS");
    if (url==null || user==null || pass==null) {
      System.err.println("Missing PG_URL/PG_USER/PG_PASS");
      System.exit(2);
    }
    try (var conn = DriverManager.getConnection(url, user, pass)) {
      int n = apply(conn);
      System.out.println("Schema applied OK (" + n + " statements).");
    }
  }

  /** @return number of statements executed */
  public static int apply(Connection conn) throws SQLException {
    String sql = readSchema();
    int executed = 0;
    try (var st = conn.createStatement()) {
      // simple splitter: execute on each semicolon; ignore empty
      for (String stmt : sql.split(";")) {
        String s = stmt.trim();
        if (!s.isEmpty()) {
          st.execute(s);
          executed++;
        }
      }
    }
    return executed;
  }

  static String readSchema() {
    var in = SchemaMigrator.class.getResourceAsStream("/schema.sql");
    if (in == null)
      throw new IllegalStateException("schema.sql not found on classpath");
    try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
      return reader.lines().collect(Collectors.joining("\n"));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
