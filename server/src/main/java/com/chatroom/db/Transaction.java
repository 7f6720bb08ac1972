package com.chatroom.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * One atomic unit of work: a pooled connection with auto-commit switched off.
 *
 * <p>A transaction is either committed or rolled back exactly once. After that, or after
 * {@link #close()}, every method throws {@link IllegalStateException}, so a handle cannot leak
 * into a later business operation. Closing a transaction that is still active rolls it back.
 */
public class Transaction implements AutoCloseable {

  enum State {
    ACTIVE,
    COMMITTED,
    ROLLED_BACK,
    CLOSED
  }

  private final Connection connection;
  private State state = State.ACTIVE;

  /** Takes ownership of {@code connection}; it is closed here if it cannot be switched over. */
  Transaction(Connection connection) throws SQLException {
    this.connection = connection;
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }

  /** Returns the connection statements of this transaction run on. */
  @Nonnull
  public Connection connection() {
    checkActive();
    return connection;
  }

  public boolean isActive() {
    return state == State.ACTIVE;
  }

  State state() {
    return state;
  }

  public void commit() throws SQLException {
    checkActive();
    connection.commit();
    state = State.COMMITTED;
  }

  public void rollback() throws SQLException {
    checkActive();
    state = State.ROLLED_BACK;
    connection.rollback();
  }

  /** Marks a point this transaction can later roll back to without ending it. */
  @Nonnull
  public Savepoint setSavepoint(String name) throws SQLException {
    checkActive();
    return connection.setSavepoint(name);
  }

  /** Undoes everything since {@code savepoint}; the transaction stays active. */
  public void rollbackTo(Savepoint savepoint) throws SQLException {
    checkActive();
    connection.rollback(savepoint);
  }

  public void releaseSavepoint(Savepoint savepoint) throws SQLException {
    checkActive();
    connection.releaseSavepoint(savepoint);
  }

  /**
   * Rolls back if still active, then returns the connection to the pool with auto-commit
   * restored. Calling it again has no effect.
   */
  @Override
  public void close() throws SQLException {
    if (state == State.CLOSED) {
      return;
    }
    try {
      if (state == State.ACTIVE) {
        Logger.debug("Rolling back uncommitted transaction");
        state = State.ROLLED_BACK;
        connection.rollback();
      }
      connection.setAutoCommit(true);
    } finally {
      state = State.CLOSED;
      connection.close();
    }
  }

  private void checkActive() {
    if (state != State.ACTIVE) {
      throw new IllegalStateException("Transaction is no longer active: " + state);
    }
  }
}
