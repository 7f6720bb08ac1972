package com.chatroom.controller;

import com.chatroom.common.status.Status;
import com.chatroom.common.status.StatusCode;
import com.chatroom.db.ChatDAO;
import com.chatroom.db.DaoException;
import com.chatroom.db.Database;
import com.chatroom.db.Transaction;
import com.chatroom.db.util.DbUtil;
import com.chatroom.model.MessageDTO;
import com.chatroom.model.UserDTO;
import com.chatroom.util.Validators;
import com.google.common.collect.ImmutableMap;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * The application's controller, and the only entry point the web layer calls. Nothing else talks
 * to the DAO.
 *
 * <p>Each public method runs in exactly one transaction: it is committed when the method returns
 * and rolled back when it throws. Exceptions reach the caller unchanged.
 */
public class Controller {

  /** How long a login keeps a user logged in. */
  public static final Duration SESSION_LENGTH = Duration.ofHours(24);

  /** How many transactions a contended login may take before its failure is reported. */
  static final int LOGIN_ATTEMPTS = 5;

  private final Database database;
  private final ChatDAO chatDAO;
  private final Clock clock;
  private final Duration sessionLength;

  Controller(Database database, ChatDAO chatDAO, Clock clock, Duration sessionLength) {
    this.database = database;
    this.chatDAO = chatDAO;
    this.clock = clock;
    this.sessionLength = sessionLength;
  }

  /**
   * Creates the controller the web layer holds for the lifetime of the process. Applies the
   * schema if configured to, then checks that the store answers.
   *
   * @throws DaoException if the schema cannot be applied or the store is unreachable
   */
  @Nonnull
  public static Controller create(Database database) {
    return create(database, Clock.systemUTC());
  }

  @Nonnull
  static Controller create(Database database, Clock clock) {
    ChatDAO chatDAO = new ChatDAO(database.dataSource());
    if (database.config().initSchema()) {
      chatDAO.applySchema();
    }
    chatDAO.verifyConnectivity();
    Logger.info("Controller ready");
    return new Controller(database, chatDAO, clock, SESSION_LENGTH);
  }

  /**
   * Logs in a user. No password is involved: a username never seen before is registered on the
   * spot. Either way the session is extended to {@link #SESSION_LENGTH} from now.
   *
   * <p>A login that collides with a concurrent one for the same name is retried in a fresh
   * transaction, up to {@link #LOGIN_ATTEMPTS} times in all.
   *
   * @param username the username of the user logging in
   * @return the logged in user, with the extended session
   */
  @Nonnull
  public UserDTO login(String username) {
    for (int attempt = 1; ; attempt++) {
      try {
        return inTransaction("login", tx -> loginOnce(username, tx));
      } catch (DaoException e) {
        if (attempt >= LOGIN_ATTEMPTS || !isLoginConflict(e)) {
          throw e;
        }
        Logger.debug("Login of {} collided with a concurrent login (attempt {}), retrying",
            username, attempt);
      }
    }
  }

  private UserDTO loginOnce(String username, Transaction tx) throws SQLException {
    UserDTO.validateUsername(username, "username");
    List<UserDTO> users = chatDAO.findUserByUsername(username, tx);
    UserDTO user = users.isEmpty() ? registerUser(username, tx) : users.get(0);
    UserDTO loggedIn = user.withLoggedInUntil(clock.instant().plus(sessionLength));
    chatDAO.updateUser(loggedIn, tx);
    Logger.info("User {} (id {}) logged in until {}", username, loggedIn.id(),
        loggedIn.loggedInUntil());
    return loggedIn;
  }

  /**
   * A name registered by a transaction our snapshot cannot see, or a write conflict under
   * REPEATABLE READ or SERIALIZABLE. A new transaction sees the committed row.
   */
  private static boolean isLoginConflict(DaoException e) {
    return e.getCode() == StatusCode.ALREADY_EXISTS || e.getCode() == StatusCode.ABORTED;
  }

  /**
   * Checks whether the specified user is logged in.
   *
   * @param username the username to check
   * @return the user if its session has not expired, empty otherwise or if there is no such user
   */
  @Nonnull
  public Optional<UserDTO> isLoggedIn(String username) {
    return inTransaction("isLoggedIn", tx -> {
      UserDTO.validateUsername(username, "username");
      List<UserDTO> users = chatDAO.findUserByUsername(username, tx);
      if (users.isEmpty()) {
        return Optional.empty();
      }
      UserDTO user = users.get(0);
      Instant loginExpires = user.loggedInUntil();
      if (!loginExpires.isAfter(clock.instant())) {
        return Optional.empty();
      }
      return Optional.of(user);
    });
  }

  /**
   * Adds a message to the conversation.
   *
   * @param msg the message text
   * @param author the message author
   * @return the newly created message
   */
  @Nonnull
  public MessageDTO addMsg(String msg, UserDTO author) {
    return inTransaction("addMsg", tx -> {
      Validators.isNonZeroLengthString(msg, "msg");
      Validators.isInstanceOf(author, UserDTO.class, "user", "UserDTO");
      return chatDAO.createMsg(msg, author, tx);
    });
  }

  /** Returns the message with the specified id, or empty if there is none or it was deleted. */
  @Nonnull
  public Optional<MessageDTO> findMsg(long msgId) {
    return inTransaction("findMsg", tx -> {
      Validators.isPositiveInteger(msgId, "msgId");
      return chatDAO.findMsgById(msgId, tx);
    });
  }

  /** Returns the user with the specified id, or empty if there is none. */
  @Nonnull
  public Optional<UserDTO> findUser(long id) {
    return inTransaction("findUser", tx -> {
      Validators.isPositiveInteger(id, "id");
      return chatDAO.findUserById(id, tx);
    });
  }

  /** Returns all messages that are not deleted, oldest first. */
  @Nonnull
  public List<MessageDTO> findAllMsgs() {
    return inTransaction("findAllMsgs", chatDAO::findAllMsgs);
  }

  /**
   * Deletes the message with the specified id. Deleting a message that does not exist is not an
   * error.
   */
  public void deleteMsg(long msgId) {
    inTransaction("deleteMsg", tx -> {
      Validators.isPositiveInteger(msgId, "msgId");
      return chatDAO.deleteMsg(msgId, tx);
    });
  }

  /**
   * Creates {@code username}. If a concurrent login registered the same name first, the insert
   * hits the unique index; the savepoint keeps the transaction usable so the winner's row can be
   * read instead. Under a snapshot isolation level the winner's row stays invisible, and the
   * ALREADY_EXISTS failure is left to {@link #login(String)} to retry.
   */
  private UserDTO registerUser(String username, Transaction tx) throws SQLException {
    Savepoint beforeInsert = tx.setSavepoint("register_user");
    try {
      UserDTO created = chatDAO.createUser(username, tx);
      tx.releaseSavepoint(beforeInsert);
      Logger.info("Registered new user {} with id {}", username, created.id());
      return created;
    } catch (DaoException e) {
      if (e.getCode() != StatusCode.ALREADY_EXISTS) {
        throw e;
      }
      tx.rollbackTo(beforeInsert);
      Logger.info("User {} was registered concurrently, reading the existing row", username);
      List<UserDTO> users = chatDAO.findUserByUsername(username, tx);
      if (users.isEmpty()) {
        throw e;
      }
      return users.get(0);
    }
  }

  /** Body of a business operation. */
  @FunctionalInterface
  interface TransactionalWork<T> {
    T execute(Transaction tx) throws SQLException;
  }

  /**
   * Runs {@code work} in a new transaction. Commits if it returns; otherwise the transaction is
   * rolled back when it is closed and the exception propagates.
   */
  private <T> T inTransaction(String operation, TransactionalWork<T> work) {
    Transaction tx;
    try {
      tx = database.beginTransaction();
    } catch (SQLException e) {
      throw storeFailure(operation, "Could not start a transaction", e);
    }
    try (tx) {
      T result = work.execute(tx);
      tx.commit();
      return result;
    } catch (SQLException e) {
      throw storeFailure(operation, "Transaction failed", e);
    }
  }

  private static DaoException storeFailure(String operation, String message, SQLException e) {
    Status status = DbUtil.toStatus(e, message);
    return new DaoException(message + " in " + operation + ".", operation, ImmutableMap.of(),
        status);
  }
}
