package com.altivion.api.store;

import com.altivion.api.model.Signal;
import java.util.List;

/**
 * Callback run by {@link JdbcSignalStore} after a batch has been committed.
 *
 * <p>Hooks are best-effort: any exception they throw is logged and discarded by the store and
 * never reported as an insert failure.
 */
@FunctionalInterface
public interface SignalCommitHook {
  void afterCommit(List<Signal> batch);
}
