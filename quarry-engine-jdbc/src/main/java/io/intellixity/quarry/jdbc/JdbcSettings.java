package io.intellixity.quarry.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection settings read from {@link Properties}.\n
 *
 * Keys: {@code quarry.jdbc.url}, {@code quarry.jdbc.username}, {@code quarry.jdbc.password},
 * {@code quarry.jdbc.schema}, {@code quarry.jdbc.maximumPoolSize} (default 10), {@code quarry.jdbc.debugSql}.
 */
public record JdbcSettings(String url, String username, String password, String schema,
                           int maximumPoolSize, boolean debugSql) {
  public static final String DEFAULT_RESOURCE = "quarry.properties";
  private static final String PREFIX = "quarry.jdbc.";

  public JdbcSettings {
    Objects.requireNonNull(url, PREFIX + "url");
    if (maximumPoolSize < 1) throw new IllegalArgumentException(PREFIX + "maximumPoolSize must be >= 1");
  }

  public static JdbcSettings from(Properties props) {
    String url = props.getProperty(PREFIX + "url");
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("Missing required property " + PREFIX + "url");
    }
    String pool = props.getProperty(PREFIX + "maximumPoolSize", "10").trim();
    int maxPool;
    try {
      maxPool = Integer.parseInt(pool);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(PREFIX + "maximumPoolSize is not a number: " + pool, e);
    }
    return new JdbcSettings(
        url.trim(),
        props.getProperty(PREFIX + "username"),
        props.getProperty(PREFIX + "password"),
        blankToNull(props.getProperty(PREFIX + "schema")),
        maxPool,
        Boolean.parseBoolean(props.getProperty(PREFIX + "debugSql", "false").trim()));
  }

  public static JdbcSettings fromClasspath() {
    return fromClasspath(DEFAULT_RESOURCE);
  }

  public static JdbcSettings fromClasspath(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = JdbcSettings.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalArgumentException("Classpath resource not found: " + resource);
      Properties props = new Properties();
      props.load(in);
      return from(props);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read " + resource, e);
    }
  }

  HikariConfig hikariConfig() {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(url);
    if (username != null) hc.setUsername(username);
    if (password != null) hc.setPassword(password);
    if (schema != null) hc.setSchema(schema);
    hc.setMaximumPoolSize(maximumPoolSize);
    hc.setPoolName("quarry");
    // uuid and enum columns compare against text placeholders
    hc.addDataSourceProperty("stringtype", "unspecified");
    return hc;
  }

  public HikariDataSource dataSource() {
    return new HikariDataSource(hikariConfig());
  }

  public SqlDiagnostics diagnostics() {
    return debugSql ? new Slf4jSqlDiagnostics() : SqlDiagnostics.none();
  }

  @Override
  public String toString() {
    return "JdbcSettings[url=" + url + ", username=" + username + ", schema=" + schema
        + ", maximumPoolSize=" + maximumPoolSize + ", debugSql=" + debugSql + "]";
  }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s.trim();
  }
}
