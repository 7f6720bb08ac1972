package com.chatroom.model;

import com.chatroom.util.Validators;
import java.time.Instant;
import javax.annotation.Nullable;

/**
 * A chat message together with its author.
 *
 * @param id store-assigned id, positive
 * @param author the user who wrote the message
 * @param msg the message text, never empty
 * @param createdAt when the message was posted
 * @param updatedAt when the row was last changed
 * @param deletedAt when the message was soft-deleted, or null
 */
public record MessageDTO(
    long id,
    UserDTO author,
    String msg,
    Instant createdAt,
    Instant updatedAt,
    @Nullable Instant deletedAt) {

  public MessageDTO {
    Validators.isPositiveInteger(id, "id");
    Validators.isInstanceOf(author, UserDTO.class, "author", "UserDTO");
    Validators.isNonZeroLengthString(msg, "msg");
    Validators.isValidDate(createdAt, "createdAt");
    Validators.isValidDate(updatedAt, "updatedAt");
  }
}
