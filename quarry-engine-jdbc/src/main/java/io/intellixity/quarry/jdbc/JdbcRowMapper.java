package io.intellixity.quarry.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresql.util.PGobject;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Maps result rows to ordered maps keyed by column label. */
final class JdbcRowMapper {
  private final ObjectMapper mapper;

  JdbcRowMapper(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  List<Map<String, Object>> readAll(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    String[] labels = new String[n];
    for (int i = 1; i <= n; i++) labels[i - 1] = md.getColumnLabel(i);

    List<Map<String, Object>> rows = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 1; i <= n; i++) {
        row.put(labels[i - 1], convert(rs.getObject(i)));
      }
      rows.add(row);
    }
    return rows;
  }

  private Object convert(Object v) throws SQLException {
    if (v instanceof Array a) {
      Object arr = a.getArray();
      return arr instanceof Object[] objs ? new ArrayList<>(Arrays.asList(objs)) : arr;
    }
    if (v instanceof PGobject pg && pg.getValue() != null
        && ("json".equals(pg.getType()) || "jsonb".equals(pg.getType()))) {
      try {
        return mapper.readValue(pg.getValue(), Object.class);
      } catch (JsonProcessingException e) {
        throw new SQLException("Unable to read " + pg.getType() + " column", e);
      }
    }
    return v;
  }
}
