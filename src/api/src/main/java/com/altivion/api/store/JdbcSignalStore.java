package com.altivion.api.store;

import com.altivion.api.model.Signal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * PostgreSQL implementation of {@link SignalStore} on top of {@link JdbcTemplate}.
 *
 * <p>The batch insert runs inside a {@link TransactionTemplate}; registered
 * {@link SignalCommitHook}s are invoked only once that transaction has committed.
 */
@Repository
public class JdbcSignalStore implements SignalStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcSignalStore.class);

  static final String INSERT_SQL =
      "INSERT INTO drone_signals "
          + "(ts, sn, uasid, drone_type, direction_deg, speed_h_mps, speed_v_mps, "
          + "lat, lon, height_m, operator_lat, operator_lon) "
          + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final List<SignalCommitHook> commitHooks;

  /**
   * Creates the store.
   *
   * @param jdbcTemplate JDBC access template
   * @param transactionManager manager used for the batch transaction
   * @param commitHooks post-commit callbacks, possibly empty
   */
  public JdbcSignalStore(
      JdbcTemplate jdbcTemplate,
      PlatformTransactionManager transactionManager,
      List<SignalCommitHook> commitHooks) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.commitHooks = List.copyOf(commitHooks);
  }

  @Override
  public void insertBatch(List<Signal> rows) {
    if (rows.isEmpty()) {
      return;
    }
    try {
      transactionTemplate.executeWithoutResult(
          status -> jdbcTemplate.batchUpdate(INSERT_SQL, rows, rows.size(), JdbcSignalStore::bind));
    } catch (DataAccessException | TransactionException ex) {
      throw new StoreException("failed to insert " + rows.size() + " signal(s)", ex);
    }
    runCommitHooks(rows);
  }

  @Override
  public List<Map<String, Object>> query(String sql, Object... params) {
    try {
      return jdbcTemplate.queryForList(sql, params);
    } catch (DataAccessException ex) {
      throw new StoreException("signal query failed", ex);
    }
  }

  private void runCommitHooks(List<Signal> rows) {
    for (SignalCommitHook hook : commitHooks) {
      try {
        hook.afterCommit(rows);
      } catch (Exception ex) {
        log.debug("Post-commit hook {} failed", hook.getClass().getSimpleName(), ex);
      }
    }
  }

  private static void bind(PreparedStatement ps, Signal row) throws SQLException {
    ps.setObject(1, OffsetDateTime.ofInstant(row.ts(), ZoneOffset.UTC));
    ps.setString(2, row.sn());
    ps.setString(3, row.uasid());
    ps.setString(4, row.droneType());
    setNullableInt(ps, 5, row.directionDeg());
    setNullableDouble(ps, 6, row.speedHMps());
    setNullableDouble(ps, 7, row.speedVMps());
    setNullableDouble(ps, 8, row.lat());
    setNullableDouble(ps, 9, row.lon());
    setNullableDouble(ps, 10, row.heightM());
    setNullableDouble(ps, 11, row.operatorLat());
    setNullableDouble(ps, 12, row.operatorLon());
  }

  private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
    if (value == null) {
      ps.setNull(index, Types.INTEGER);
    } else {
      ps.setInt(index, value);
    }
  }

  private static void setNullableDouble(PreparedStatement ps, int index, Double value) throws SQLException {
    if (value == null) {
      ps.setNull(index, Types.DOUBLE);
    } else {
      ps.setDouble(index, value);
    }
  }
}
