package com.chatroom.db;

import com.chatroom.common.status.Status;
import com.chatroom.common.status.StatusCode;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * A failed store operation. Carries the {@link Status} the failure was mapped to, the name of the
 * DAO operation, and the parameters it was called with. The driver exception, if any, is the
 * cause.
 */
public class DaoException extends RuntimeException {
  private final Status status;
  private final String operation;
  private final ImmutableMap<String, Object> parameters;

  public DaoException(
      String message, String operation, Map<String, ?> parameters, Status status) {
    super(message + " (" + status + ")", status.getCause());
    this.status = status;
    this.operation = operation;
    this.parameters = ImmutableMap.copyOf(parameters);
  }

  @Nonnull
  public Status getStatus() {
    return status;
  }

  @Nonnull
  public StatusCode getCode() {
    return status.getCode();
  }

  /** Returns the name of the DAO method that failed, e.g. {@code createUser}. */
  @Nonnull
  public String getOperation() {
    return operation;
  }

  /** Returns the parameters the failed operation was called with, in call order. */
  @Nonnull
  public ImmutableMap<String, Object> getParameters() {
    return parameters;
  }
}
