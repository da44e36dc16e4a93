package io.intellixity.quarry.jdbc;

import com.zaxxer.hikari.HikariConfig;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcSettingsTest {

  @Test
  void readsClasspathProperties() {
    JdbcSettings s = JdbcSettings.fromClasspath("quarry-test.properties");
    assertEquals("jdbc:postgresql://localhost:5432/catalog", s.url());
    assertEquals("quarry", s.username());
    assertEquals("secret", s.password());
    assertEquals("catalog", s.schema());
    assertEquals(4, s.maximumPoolSize());
    assertTrue(s.debugSql());
    assertInstanceOf(Slf4jSqlDiagnostics.class, s.diagnostics());
    assertFalse(s.toString().contains("secret"));
  }

  @Test
  void defaults() {
    Properties p = new Properties();
    p.setProperty("quarry.jdbc.url", "jdbc:postgresql://db/app");
    p.setProperty("quarry.jdbc.schema", "  ");
    JdbcSettings s = JdbcSettings.from(p);
    assertEquals(10, s.maximumPoolSize());
    assertNull(s.schema());
    assertFalse(s.debugSql());
    assertSame(SqlDiagnostics.none(), s.diagnostics());
  }

  @Test
  void hikariConfigCarriesSettings() {
    JdbcSettings s = new JdbcSettings("jdbc:postgresql://db/app", "u", "p", "catalog", 3, false);
    HikariConfig hc = s.hikariConfig();
    assertEquals("jdbc:postgresql://db/app", hc.getJdbcUrl());
    assertEquals("u", hc.getUsername());
    assertEquals("catalog", hc.getSchema());
    assertEquals(3, hc.getMaximumPoolSize());
    assertEquals("unspecified", hc.getDataSourceProperties().getProperty("stringtype"));
  }

  @Test
  void rejectsMissingUrlAndBadPoolSize() {
    assertThrows(IllegalArgumentException.class, () -> JdbcSettings.from(new Properties()));

    Properties p = new Properties();
    p.setProperty("quarry.jdbc.url", "jdbc:postgresql://db/app");
    p.setProperty("quarry.jdbc.maximumPoolSize", "many");
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> JdbcSettings.from(p));
    assertTrue(e.getMessage().contains("maximumPoolSize"));

    assertThrows(IllegalArgumentException.class, () -> JdbcSettings.fromClasspath("missing.properties"));
  }
}
