package com.chatroom.common.status;

import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The outcome of a data-layer operation: a {@link StatusCode}, an optional message and an optional
 * underlying cause.
 */
public final class Status {
  private static final Status OK = new Status(StatusCode.OK, null, null);

  private final StatusCode code;
  private final String message;
  private final Throwable cause;

  private Status(StatusCode code, String message, Throwable cause) {
    this.code = Objects.requireNonNull(code);
    this.message = message;
    this.cause = cause;
  }

  /** Creates a new status with the given code, message, and cause. */
  public static Status of(StatusCode code, String message, @Nullable Throwable cause) {
    return new Status(code, message, cause);
  }

  /** Returns the OK status. */
  public static Status ok() {
    return OK;
  }

  /** Creates a new NOT_FOUND status with the given message. */
  public static Status notFound(String message) {
    return new Status(StatusCode.NOT_FOUND, message, null);
  }

  /** Creates a new INTERNAL status with the given message and cause. */
  public static Status internal(String message, @Nullable Throwable cause) {
    return new Status(StatusCode.INTERNAL, message, cause);
  }

  /** Creates a new INVALID_ARGUMENT status with the given message. */
  public static Status invalidArgument(String message) {
    return new Status(StatusCode.INVALID_ARGUMENT, message, null);
  }

  /** Creates a new ALREADY_EXISTS status with the given message and cause. */
  public static Status alreadyExists(String message, @Nullable Throwable cause) {
    return new Status(StatusCode.ALREADY_EXISTS, message, cause);
  }

  /** Creates a new FAILED_PRECONDITION status with the given message and cause. */
  public static Status failedPrecondition(String message, @Nullable Throwable cause) {
    return new Status(StatusCode.FAILED_PRECONDITION, message, cause);
  }

  /** Creates a new ABORTED status with the given message and cause. */
  public static Status aborted(String message, @Nullable Throwable cause) {
    return new Status(StatusCode.ABORTED, message, cause);
  }

  /** Creates a new UNAVAILABLE status with the given message and cause. */
  public static Status unavailable(String message, @Nullable Throwable cause) {
    return new Status(StatusCode.UNAVAILABLE, message, cause);
  }

  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the HTTP status code corresponding to this status. */
  public int getHttpCode() {
    return code.getHttpCode();
  }

  @Nullable
  public String getMessage() {
    return message;
  }

  @Nullable
  public Throwable getCause() {
    return cause;
  }

  public boolean isOk() {
    return code == StatusCode.OK;
  }

  public boolean isError() {
    return code.isError();
  }

  @Override
  public String toString() {
    if (message == null) {
      return code.toString();
    }
    return code + ": " + message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code
        && Objects.equals(message, other.message)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, cause);
  }
}
