package com.chatroom.db;

import com.chatroom.common.status.Status;
import com.chatroom.common.status.StatusOr;
import com.chatroom.db.util.DbUtil;
import com.chatroom.model.MessageDTO;
import com.chatroom.model.UserDTO;
import com.chatroom.util.Validators;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.sql.DataSource;
import org.tinylog.Logger;

/**
 * All database access of the chat. No SQL lives outside this package.
 *
 * <p>Every operation has two forms. The one taking a {@link Transaction} runs on that
 * transaction's connection; the other borrows an auto-commit connection from the pool for the
 * single statement and is meant for trivial reads outside a business operation.
 *
 * <p>Arguments are validated before the store is touched and invalid ones raise
 * {@link com.chatroom.util.ValidationException}. Store failures raise {@link DaoException} with the
 * operation name and its parameters. Lookups that find nothing return an empty {@code Optional} or
 * list.
 */
public class ChatDAO {

  /** Classpath location of the schema script. */
  public static final String SCHEMA_RESOURCE = "db/01-schema.sql";

  private final DataSource dataSource;

  public ChatDAO(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  /**
   * Applies the schema script. Every statement in it is idempotent.
   *
   * @throws DaoException if the script cannot be read or executed
   */
  public void applySchema() {
    String schema;
    try {
      URL url = Resources.getResource(SCHEMA_RESOURCE);
      schema = Resources.toString(url, StandardCharsets.UTF_8);
    } catch (IOException | IllegalArgumentException e) {
      throw new DaoException(
          "Could not read the database schema.",
          "applySchema",
          ImmutableMap.of("resource", SCHEMA_RESOURCE),
          Status.internal("Schema resource unreadable", e));
    }
    run("Could not apply the database schema.", "applySchema", ImmutableMap.of(), null, conn -> {
      try (Statement stmt = conn.createStatement()) {
        stmt.execute(schema);
        return StatusOr.ofValue(Boolean.TRUE);
      } catch (SQLException e) {
        return DbUtil.failure(e, "Failed to execute " + SCHEMA_RESOURCE);
      }
    });
    Logger.info("Database schema applied from {}", SCHEMA_RESOURCE);
  }

  /**
   * Checks that the store answers a trivial query.
   *
   * @throws DaoException with status UNAVAILABLE or INTERNAL if it does not
   */
  public void verifyConnectivity() {
    run("Could not connect to database.", "verifyConnectivity", ImmutableMap.of(), null, conn -> {
      try (Statement stmt = conn.createStatement();
          ResultSet rs = stmt.executeQuery("SELECT 1")) {
        if (!rs.next()) {
          return StatusOr.ofStatus(Status.internal("SELECT 1 returned no row", null));
        }
        return StatusOr.ofValue(Boolean.TRUE);
      } catch (SQLException e) {
        return DbUtil.failure(e, "Connectivity check failed");
      }
    });
  }

  @Nonnull
  public List<UserDTO> findUserByUsername(String username) {
    return findUserByUsername(username, null);
  }

  /**
   * Searches for live users with the specified username.
   *
   * @return the matching users, empty if there are none
   */
  @Nonnull
  public List<UserDTO> findUserByUsername(String username, @Nullable Transaction tx) {
    UserDTO.validateUsername(username, "username");
    return run(
        "Could not search for user " + username + ".",
        "findUserByUsername",
        ImmutableMap.of("username", username),
        tx,
        conn -> Users.loadByUsername(conn, username));
  }

  @Nonnull
  public Optional<UserDTO> findUserById(long id) {
    return findUserById(id, null);
  }

  /**
   * Searches for the live user with the specified id.
   *
   * @return the user, or empty if there is no such user or it was soft-deleted
   */
  @Nonnull
  public Optional<UserDTO> findUserById(long id, @Nullable Transaction tx) {
    Validators.isPositiveInteger(id, "id");
    return run(
        "Could not search for user " + id + ".",
        "findUserById",
        ImmutableMap.of("id", id),
        tx,
        conn -> Users.loadById(conn, id));
  }

  @Nonnull
  public UserDTO createUser(String username) {
    return createUser(username, null);
  }

  /**
   * Creates a user that has never logged in.
   *
   * @return the newly created user
   * @throws DaoException with status ALREADY_EXISTS if a live user already has this name
   */
  @Nonnull
  public UserDTO createUser(String username, @Nullable Transaction tx) {
    UserDTO.validateUsername(username, "username");
    return run(
        "Could not create user " + username + ".",
        "createUser",
        ImmutableMap.of("username", username),
        tx,
        conn -> Users.insert(conn, username));
  }

  public int updateUser(UserDTO user) {
    return updateUser(user, null);
  }

  /**
   * Persists the username and session expiry of {@code user}, matched by id. Matching no row is
   * not an error.
   *
   * @return the number of updated rows, 0 or 1
   */
  public int updateUser(UserDTO user, @Nullable Transaction tx) {
    Validators.isInstanceOf(user, UserDTO.class, "user", "UserDTO");
    int updated = run(
        "Could not update user " + user.username() + ".",
        "updateUser",
        ImmutableMap.of("id", user.id(), "username", user.username()),
        tx,
        conn -> Users.update(conn, user));
    if (updated == 0) {
      Logger.debug("updateUser matched no row for user id {}", user.id());
    }
    return updated;
  }

  @Nonnull
  public MessageDTO createMsg(String text, UserDTO author) {
    return createMsg(text, author, null);
  }

  /**
   * Creates a message by {@code author}. The returned message holds {@code author} exactly as
   * passed in; the author row is not re-read.
   *
   * @return the newly created message
   * @throws DaoException with status FAILED_PRECONDITION if the author row does not exist
   */
  @Nonnull
  public MessageDTO createMsg(String text, UserDTO author, @Nullable Transaction tx) {
    Validators.isNonZeroLengthString(text, "msg");
    Validators.isInstanceOf(author, UserDTO.class, "author", "UserDTO");
    return run(
        "Could not create message " + text + " by " + author.username() + ".",
        "createMsg",
        ImmutableMap.of("msg", text, "authorId", author.id()),
        tx,
        conn -> Msgs.insert(conn, text, author));
  }

  @Nonnull
  public Optional<MessageDTO> findMsgById(long id) {
    return findMsgById(id, null);
  }

  /**
   * Searches for the message with the specified id, with its author.
   *
   * @return the message, or empty if there is none or it was deleted
   */
  @Nonnull
  public Optional<MessageDTO> findMsgById(long id, @Nullable Transaction tx) {
    Validators.isPositiveInteger(id, "msgId");
    return run(
        "Could not search for message " + id + ".",
        "findMsgById",
        ImmutableMap.of("msgId", id),
        tx,
        conn -> Msgs.loadById(conn, id));
  }

  @Nonnull
  public List<MessageDTO> findAllMsgs() {
    return findAllMsgs(null);
  }

  /**
   * Reads all messages that are not deleted, each with its author, in the order they were
   * created.
   */
  @Nonnull
  public List<MessageDTO> findAllMsgs(@Nullable Transaction tx) {
    return run("Could not read messages.", "findAllMsgs", ImmutableMap.of(), tx, Msgs::loadAll);
  }

  public int deleteMsg(long id) {
    return deleteMsg(id, null);
  }

  /**
   * Soft-deletes the message with the specified id. The row stays in the table with deleted_at
   * set. Deleting a missing or already deleted message is not an error.
   *
   * @return the number of rows marked deleted, 0 or 1
   */
  public int deleteMsg(long id, @Nullable Transaction tx) {
    Validators.isPositiveInteger(id, "msgId");
    int deleted = run(
        "Could not delete message " + id + ".",
        "deleteMsg",
        ImmutableMap.of("msgId", id),
        tx,
        conn -> Msgs.softDelete(conn, id));
    if (deleted == 0) {
      Logger.debug("deleteMsg matched no live message with id {}", id);
    }
    return deleted;
  }

  /**
   * Runs {@code statement} on the transaction's connection, or on a pooled auto-commit
   * connection when {@code tx} is null, and unwraps the result.
   */
  private <T> T run(
      String message,
      String operation,
      Map<String, ?> parameters,
      @Nullable Transaction tx,
      Function<Connection, StatusOr<T>> statement) {
    StatusOr<T> result;
    if (tx != null) {
      result = statement.apply(tx.connection());
    } else {
      try (Connection conn = dataSource.getConnection()) {
        result = statement.apply(conn);
      } catch (SQLException e) {
        result = DbUtil.failure(e, "Could not obtain a database connection");
      }
    }
    if (result.isNotOk()) {
      throw new DaoException(message, operation, parameters, result.getStatus());
    }
    return result.getValue();
  }
}
