package io.intellixity.quarry.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresql.util.PGobject;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Binds compiled parameters onto a {@link PreparedStatement} the way pgjdbc expects them.\n
 *
 * Lists become SQL arrays with an element type taken from the first non-null element, maps become jsonb,
 * {@link Instant} and {@link Date} become timestamps. Everything else goes through {@code setObject}.
 */
public final class PostgresParameterBinder {
  private final ObjectMapper mapper;

  public PostgresParameterBinder() {
    this(new ObjectMapper());
  }

  public PostgresParameterBinder(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public void bindAll(PreparedStatement ps, List<Object> values) throws SQLException {
    for (int i = 0; i < values.size(); i++) {
      bind(ps, i + 1, values.get(i));
    }
  }

  public void bind(PreparedStatement ps, int idx, Object v) throws SQLException {
    if (v == null) {
      ps.setNull(idx, Types.NULL);
      return;
    }
    if (v instanceof Map<?, ?> m) {
      ps.setObject(idx, jsonb(m));
      return;
    }
    if (v instanceof Object[] arr) {
      bindArray(ps, idx, List.of(arr));
      return;
    }
    if (v instanceof Collection<?> c) {
      bindArray(ps, idx, c);
      return;
    }
    if (v instanceof Instant i) {
      ps.setTimestamp(idx, Timestamp.from(i));
      return;
    }
    if (v instanceof Timestamp ts) {
      ps.setTimestamp(idx, ts);
      return;
    }
    if (v instanceof Date d) {
      ps.setTimestamp(idx, new Timestamp(d.getTime()));
      return;
    }
    ps.setObject(idx, v);
  }

  private void bindArray(PreparedStatement ps, int idx, Collection<?> c) throws SQLException {
    String pgElem = elementType(c);
    Object[] arr = new Object[c.size()];
    int i = 0;
    for (Object e : c) {
      arr[i++] = ("text".equals(pgElem) && e != null && !(e instanceof String)) ? String.valueOf(e) : e;
    }
    ps.setArray(idx, ps.getConnection().createArrayOf(pgElem, arr));
  }

  static String elementType(Collection<?> c) {
    for (Object e : c) {
      if (e == null) continue;
      if (e instanceof Integer || e instanceof Short) return "int4";
      if (e instanceof Long) return "int8";
      if (e instanceof BigDecimal) return "numeric";
      if (e instanceof Double || e instanceof Float) return "float8";
      if (e instanceof Boolean) return "bool";
      if (e instanceof UUID) return "uuid";
      return "text";
    }
    return "text";
  }

  private PGobject jsonb(Object value) throws SQLException {
    PGobject o = new PGobject();
    o.setType("jsonb");
    try {
      o.setValue(mapper.writeValueAsString(value));
    } catch (JsonProcessingException e) {
      throw new SQLException("Unable to serialize jsonb parameter", e);
    }
    return o;
  }
}
