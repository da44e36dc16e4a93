package io.intellixity.quarry.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.quarry.postgres.PostgresQueryBuilder;
import io.intellixity.quarry.postgres.QueryAndParams;
import io.intellixity.quarry.query.DeleteCommand;
import io.intellixity.quarry.query.InsertCommand;
import io.intellixity.quarry.query.OnConflict;
import io.intellixity.quarry.query.SelectQuery;
import io.intellixity.quarry.query.UpdateCommand;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Executes statements for one model against a {@link DataSource}.\n
 *
 * Each call borrows a connection and returns it before the method returns.
 * Rows come back as maps keyed by column label ({@code "c" AS "p"} projections give property names).
 */
public final class JdbcRepository {
  private final DataSource dataSource;
  private final PostgresQueryBuilder builder;
  private final String model;
  private final SqlDiagnostics diagnostics;
  private final PostgresParameterBinder binder;
  private final JdbcRowMapper rows;

  public JdbcRepository(DataSource dataSource, PostgresQueryBuilder builder, String model) {
    this(dataSource, builder, model, SqlDiagnostics.none());
  }

  public JdbcRepository(DataSource dataSource, PostgresQueryBuilder builder, String model, SqlDiagnostics diagnostics) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.builder = Objects.requireNonNull(builder, "builder");
    this.model = builder.registry().model(Objects.requireNonNull(model, "model")).name();
    this.diagnostics = diagnostics == null ? SqlDiagnostics.none() : diagnostics;
    ObjectMapper mapper = new ObjectMapper();
    this.binder = new PostgresParameterBinder(mapper);
    this.rows = new JdbcRowMapper(mapper);
  }

  public String model() { return model; }

  public List<Map<String, Object>> find(SelectQuery query) {
    return run("find", builder.select(model, query));
  }

  /** Runs {@code query} with its limit set to 1. */
  public Optional<Map<String, Object>> findOne(SelectQuery query) {
    List<Map<String, Object>> found = run("findOne", builder.select(model, query.withLimit(1)));
    return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
  }

  public long count(Map<String, ?> where) {
    return count(SelectQuery.where(where));
  }

  public long count(SelectQuery query) {
    List<Map<String, Object>> out = run("count", builder.count(model, query));
    if (out.isEmpty()) return 0L;
    Object c = out.get(0).get("count");
    return c instanceof Number n ? n.longValue() : 0L;
  }

  /** Inserts one row; empty when the command returns no records. */
  public Optional<Map<String, Object>> create(Map<String, ?> values) {
    List<Map<String, Object>> out = run("create", builder.insert(model, InsertCommand.of(values)));
    return out.isEmpty() ? Optional.empty() : Optional.of(out.get(0));
  }

  public List<Map<String, Object>> createMany(List<? extends Map<String, ?>> values) {
    if (values == null || values.isEmpty()) return List.of();
    return run("createMany", builder.insert(model, new InsertCommand().withRows(values)));
  }

  public List<Map<String, Object>> upsert(List<? extends Map<String, ?>> values, OnConflict onConflict) {
    if (values == null || values.isEmpty()) return List.of();
    InsertCommand cmd = new InsertCommand().withRows(values).withOnConflict(Objects.requireNonNull(onConflict, "onConflict"));
    return run("upsert", builder.insert(model, cmd));
  }

  public List<Map<String, Object>> insert(InsertCommand command) {
    return run("insert", builder.insert(model, command));
  }

  public List<Map<String, Object>> update(Map<String, ?> where, Map<String, ?> values) {
    return update(UpdateCommand.set(values).withWhere(where));
  }

  public List<Map<String, Object>> update(UpdateCommand command) {
    return run("update", builder.update(model, command));
  }

  public List<Map<String, Object>> destroy(Map<String, ?> where) {
    return destroy(DeleteCommand.where(where));
  }

  public List<Map<String, Object>> destroy(DeleteCommand command) {
    return run("destroy", builder.delete(model, command));
  }

  private List<Map<String, Object>> run(String op, QueryAndParams qp) {
    PositionalSql.Compiled c = PositionalSql.compile(qp.query(), qp.params());
    diagnostics.beforeExecute(op, model, qp.query(), qp.params());
    long start = System.nanoTime();

    try (Connection con = dataSource.getConnection();
         PreparedStatement ps = con.prepareStatement(c.sql())) {
      binder.bindAll(ps, c.binds());
      List<Map<String, Object>> out;
      if (ps.execute()) {
        try (ResultSet rs = ps.getResultSet()) {
          out = rows.readAll(rs);
        }
      } else {
        out = List.of();
      }
      diagnostics.afterExecute(op, model, System.nanoTime() - start, out);
      return out;
    } catch (SQLException e) {
      throw new QueryExecutionException(op, model, e);
    }
  }
}
