package com.chatroom.util;

import com.chatroom.common.status.Status;
import javax.annotation.Nonnull;

/**
 * Thrown when a caller-supplied value fails validation. Always raised before the store is touched
 * and always attributable to one named parameter.
 */
public class ValidationException extends IllegalArgumentException {
  private final String parameterName;
  private final Status status;

  public ValidationException(@Nonnull String parameterName, @Nonnull String message) {
    super(message);
    this.parameterName = parameterName;
    this.status = Status.invalidArgument(message);
  }

  /** Returns the name of the offending parameter. */
  @Nonnull
  public String getParameterName() {
    return parameterName;
  }

  /** Returns the INVALID_ARGUMENT status describing this failure. */
  @Nonnull
  public Status getStatus() {
    return status;
  }
}
