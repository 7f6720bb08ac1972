package com.chatroom.util;

import com.google.common.base.CharMatcher;
import java.time.Instant;
import javax.annotation.Nullable;
import org.jetbrains.annotations.Contract;

/**
 * Argument checks shared by the DTOs, the DAO and the controller.
 *
 * <p>Every method takes the value, the name of the parameter it came from and, where relevant, a
 * constraint. It returns the value unchanged when the check passes and throws
 * {@link ValidationException} naming the parameter otherwise. The checks have no side effects, so
 * validating the same value again in a lower layer is harmless.
 */
public final class Validators {

  private static final CharMatcher ALNUM =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'));

  private Validators() {
    // Utility class, no instances
  }

  /** Checks that the value is not null. */
  @Contract("null, _ -> fail")
  public static <T> T isNotNull(@Nullable T value, String name) {
    if (value == null) {
      throw new ValidationException(name, name + " must not be null");
    }
    return value;
  }

  /** Checks that the value is a string with at least one character. */
  @Contract("null, _ -> fail")
  public static String isNonZeroLengthString(@Nullable String value, String name) {
    isNotNull(value, name);
    if (value.isEmpty()) {
      throw new ValidationException(name, name + " must not be an empty string");
    }
    return value;
  }

  /** Checks that the value consists only of ASCII letters and digits. */
  @Contract("null, _ -> fail")
  public static String isAlnumString(@Nullable String value, String name) {
    isNonZeroLengthString(value, name);
    if (!ALNUM.matchesAllOf(value)) {
      throw new ValidationException(name, name + " must contain only letters and digits, got '"
          + value + "'");
    }
    return value;
  }

  /** Checks that the value is no longer than {@code maxLength} characters. */
  @Contract("null, _, _ -> fail")
  public static String isMaxLengthString(@Nullable String value, String name, int maxLength) {
    isNotNull(value, name);
    if (value.length() > maxLength) {
      throw new ValidationException(name, name + " must not exceed " + maxLength
          + " characters, got " + value.length());
    }
    return value;
  }

  /** Checks that the value is a positive integer, as all store-assigned ids are. */
  public static long isPositiveInteger(long value, String name) {
    if (value <= 0) {
      throw new ValidationException(name, name + " must be a positive integer, got " + value);
    }
    return value;
  }

  /** Checks that the value is a usable point in time. */
  @Contract("null, _ -> fail")
  public static Instant isValidDate(@Nullable Instant value, String name) {
    if (value == null) {
      throw new ValidationException(name, name + " must be a valid date");
    }
    return value;
  }

  /**
   * Checks that the value is an instance of {@code type}. {@code typeName} is the name reported
   * in the error, usually the DTO's simple name.
   */
  @Contract("null, _, _, _ -> fail")
  public static <T> T isInstanceOf(
      @Nullable Object value, Class<T> type, String name, String typeName) {
    if (!type.isInstance(value)) {
      String actual = value == null ? "null" : value.getClass().getSimpleName();
      throw new ValidationException(name, name + " must be an instance of " + typeName
          + ", got " + actual);
    }
    return type.cast(value);
  }
}
