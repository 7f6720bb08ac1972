package com.chatroom.model;

import com.chatroom.util.Validators;
import java.time.Instant;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A chat user as seen by the business layer.
 *
 * <p>Every field is validated on construction, so an instance is never partially valid. Whether
 * the user is logged in is decided by the caller from {@link #loggedInUntil()}.
 *
 * @param id store-assigned id, positive
 * @param username non-empty, alphanumeric, at most {@link #MAX_USERNAME_LENGTH} characters
 * @param loggedInUntil end of the current session; the epoch for a user who never logged in
 * @param createdAt when the row was inserted
 * @param updatedAt when the row was last changed
 * @param deletedAt when the row was soft-deleted, or null
 */
public record UserDTO(
    long id,
    String username,
    Instant loggedInUntil,
    Instant createdAt,
    Instant updatedAt,
    @Nullable Instant deletedAt) {

  public static final int MAX_USERNAME_LENGTH = 50;

  public UserDTO {
    Validators.isPositiveInteger(id, "id");
    validateUsername(username, "username");
    Validators.isValidDate(loggedInUntil, "loggedInUntil");
    Validators.isValidDate(createdAt, "createdAt");
    Validators.isValidDate(updatedAt, "updatedAt");
  }

  /**
   * Returns a copy of this user whose session ends at {@code until}. This is the only field the
   * business layer changes; the copy still has to be persisted.
   */
  @Nonnull
  public UserDTO withLoggedInUntil(Instant until) {
    return new UserDTO(id, username, until, createdAt, updatedAt, deletedAt);
  }

  /** Applies the username rules shared by the DTO, the DAO and the controller. */
  public static String validateUsername(@Nullable String username, String name) {
    Validators.isAlnumString(username, name);
    return Validators.isMaxLengthString(username, name, MAX_USERNAME_LENGTH);
  }
}
