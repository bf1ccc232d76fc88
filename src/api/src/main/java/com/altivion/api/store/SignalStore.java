package com.altivion.api.store;

import com.altivion.api.model.Signal;
import java.util.List;
import java.util.Map;

/** Durable store contract for sensor signals. */
public interface SignalStore {
  /**
   * Writes all rows in one transaction; either every row is committed or none is.
   *
   * @param rows signals with resolved timestamps
   * @throws StoreException when the write transaction fails
   */
  void insertBatch(List<Signal> rows);

  /**
   * Runs a parameterized read statement.
   *
   * @param sql SQL statement with {@code ?} placeholders
   * @param params positional parameters
   * @return one column-name keyed map per row
   * @throws StoreException on malformed statements or connectivity loss
   */
  List<Map<String, Object>> query(String sql, Object... params);
}
