package com.chatroom.controller;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.chatroom.common.status.Status;
import com.chatroom.common.status.StatusCode;
import com.chatroom.db.ChatDAO;
import com.chatroom.db.DaoException;
import com.chatroom.db.Database;
import com.chatroom.db.Transaction;
import com.chatroom.model.MessageDTO;
import com.chatroom.model.UserDTO;
import com.chatroom.util.ValidationException;
import com.google.common.collect.ImmutableMap;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link Controller}: transaction boundaries and the login flow, with the store
 * mocked out.
 */
@ExtendWith(MockitoExtension.class)
class ControllerTest {

  private static final Instant NOW = Instant.parse("2025-01-15T09:00:00Z");
  private static final Instant CREATED = Instant.parse("2025-01-01T00:00:00Z");

  @Mock private Database database;
  @Mock private ChatDAO chatDAO;
  @Mock private Transaction tx;

  private Controller controller;

  @BeforeEach
  void setUp() throws SQLException {
    controller = new Controller(
        database, chatDAO, Clock.fixed(NOW, ZoneOffset.UTC), Controller.SESSION_LENGTH);
    lenient().when(database.beginTransaction()).thenReturn(tx);
  }

  @Test
  void login_RegistersUnknownUserAndStartsSession() throws SQLException {
    // Given: No user named alice yet
    Savepoint savepoint = mock(Savepoint.class);
    UserDTO created = user(7, "alice", Instant.EPOCH);
    when(chatDAO.findUserByUsername("alice", tx)).thenReturn(List.of());
    when(tx.setSavepoint(any())).thenReturn(savepoint);
    when(chatDAO.createUser("alice", tx)).thenReturn(created);
    when(chatDAO.updateUser(any(), eq(tx))).thenReturn(1);

    // When: alice logs in
    UserDTO loggedIn = controller.login("alice");

    // Then: She is created and her session runs for a day from now
    assertEquals(7, loggedIn.id());
    assertEquals(NOW.plus(Controller.SESSION_LENGTH), loggedIn.loggedInUntil());
    verify(tx).releaseSavepoint(savepoint);

    // And: The session was persisted before the single commit
    ArgumentCaptor<UserDTO> persisted = ArgumentCaptor.forClass(UserDTO.class);
    InOrder inOrder = inOrder(chatDAO, tx);
    inOrder.verify(chatDAO).updateUser(persisted.capture(), eq(tx));
    inOrder.verify(tx).commit();
    inOrder.verify(tx).close();
    assertEquals(loggedIn, persisted.getValue());
  }

  @Test
  void login_ExtendsSessionOfExistingUser() throws SQLException {
    UserDTO existing = user(3, "bob", NOW.minusSeconds(60));
    when(chatDAO.findUserByUsername("bob", tx)).thenReturn(List.of(existing));
    when(chatDAO.updateUser(any(), eq(tx))).thenReturn(1);

    UserDTO loggedIn = controller.login("bob");

    assertEquals(3, loggedIn.id());
    assertEquals(NOW.plus(Controller.SESSION_LENGTH), loggedIn.loggedInUntil());
    verify(chatDAO, never()).createUser(any(), any());
    verify(tx, never()).setSavepoint(any());
    verify(tx).commit();
  }

  @Test
  void login_ReadsWinnerRow_WhenConcurrentLoginRegisteredSameName() throws SQLException {
    // Given: The name is free at first, but another login inserts it before we do
    Savepoint savepoint = mock(Savepoint.class);
    UserDTO winner = user(11, "carol", Instant.EPOCH);
    when(chatDAO.findUserByUsername("carol", tx)).thenReturn(List.of(), List.of(winner));
    when(tx.setSavepoint(any())).thenReturn(savepoint);
    when(chatDAO.createUser("carol", tx)).thenThrow(duplicate("carol"));
    when(chatDAO.updateUser(any(), eq(tx))).thenReturn(1);

    // When: carol logs in
    UserDTO loggedIn = controller.login("carol");

    // Then: The failed insert is undone and the existing row is used
    verify(tx).rollbackTo(savepoint);
    verify(tx, never()).releaseSavepoint(any());
    assertEquals(11, loggedIn.id());
    verify(tx).commit();
  }

  @Test
  void login_RetriesInFreshTransaction_WhenWinnerRowIsNotYetVisible() throws SQLException {
    // Given: A snapshot that hides the winner's row until a new transaction starts
    UserDTO winner = user(11, "carol", Instant.EPOCH);
    when(chatDAO.findUserByUsername("carol", tx))
        .thenReturn(List.of(), List.of(), List.of(winner));
    when(tx.setSavepoint(any())).thenReturn(mock(Savepoint.class));
    when(chatDAO.createUser("carol", tx)).thenThrow(duplicate("carol"));
    when(chatDAO.updateUser(any(), eq(tx))).thenReturn(1);

    // When: carol logs in
    UserDTO loggedIn = controller.login("carol");

    // Then: The first transaction was abandoned and the second used the existing row
    assertEquals(11, loggedIn.id());
    assertEquals(NOW.plus(Controller.SESSION_LENGTH), loggedIn.loggedInUntil());
    verify(database, times(2)).beginTransaction();
    verify(chatDAO, times(1)).createUser("carol", tx);
    verify(tx, times(1)).commit();
    verify(tx, times(2)).close();
  }

  @Test
  void login_GivesUp_WhenConflictPersists() throws SQLException {
    when(chatDAO.findUserByUsername("carol", tx)).thenReturn(List.of());
    when(tx.setSavepoint(any())).thenReturn(mock(Savepoint.class));
    when(chatDAO.createUser("carol", tx)).thenThrow(duplicate("carol"));

    DaoException e = assertThrows(DaoException.class, () -> controller.login("carol"));

    assertEquals(StatusCode.ALREADY_EXISTS, e.getCode());
    verify(database, times(Controller.LOGIN_ATTEMPTS)).beginTransaction();
    verify(tx, never()).commit();
  }

  @Test
  void login_Retries_WhenCommitHitsSerializationFailure() throws SQLException {
    UserDTO existing = user(3, "bob", Instant.EPOCH);
    when(chatDAO.findUserByUsername("bob", tx)).thenReturn(List.of(existing));
    when(chatDAO.updateUser(any(), eq(tx))).thenReturn(1);
    doThrow(new SQLException("could not serialize access", "40001"))
        .doNothing()
        .when(tx).commit();

    UserDTO loggedIn = controller.login("bob");

    assertEquals(3, loggedIn.id());
    verify(database, times(2)).beginTransaction();
    verify(tx, times(2)).commit();
  }

  @Test
  void login_RethrowsOtherStoreErrorsAndDoesNotCommit() throws SQLException {
    DaoException outage = new DaoException(
        "Could not create user dave.", "createUser", ImmutableMap.of("username", "dave"),
        Status.unavailable("down", null));
    when(chatDAO.findUserByUsername("dave", tx)).thenReturn(List.of());
    when(tx.setSavepoint(any())).thenReturn(mock(Savepoint.class));
    when(chatDAO.createUser("dave", tx)).thenThrow(outage);

    DaoException thrown = assertThrows(DaoException.class, () -> controller.login("dave"));

    assertSame(outage, thrown);
    verify(database, times(1)).beginTransaction();
    verify(tx, never()).rollbackTo(any());
    verify(tx, never()).commit();
    verify(tx).close();
  }

  @Test
  void login_RejectsInvalidUsernameWithoutQuerying() throws SQLException {
    ValidationException e =
        assertThrows(ValidationException.class, () -> controller.login("no spaces"));

    assertEquals("username", e.getParameterName());
    verifyNoInteractions(chatDAO);
    verify(tx, never()).commit();
    verify(tx).close();
  }

  @Test
  void isLoggedIn_ReturnsUser_WhileSessionIsRunning() {
    UserDTO active = user(5, "erin", NOW.plusSeconds(1));
    when(chatDAO.findUserByUsername("erin", tx)).thenReturn(List.of(active));

    assertEquals(Optional.of(active), controller.isLoggedIn("erin"));
  }

  @Test
  void isLoggedIn_ReturnsEmpty_WhenSessionExpiredOrEndsNow() {
    when(chatDAO.findUserByUsername("frank", tx))
        .thenReturn(List.of(user(6, "frank", NOW.minusSeconds(1))));
    when(chatDAO.findUserByUsername("gina", tx)).thenReturn(List.of(user(8, "gina", NOW)));

    assertEquals(Optional.empty(), controller.isLoggedIn("frank"));
    assertEquals(Optional.empty(), controller.isLoggedIn("gina"));
  }

  @Test
  void isLoggedIn_ReturnsEmpty_WhenNoSuchUser() throws SQLException {
    when(chatDAO.findUserByUsername("nobody", tx)).thenReturn(List.of());

    assertEquals(Optional.empty(), controller.isLoggedIn("nobody"));
    verify(tx).commit();
  }

  @Test
  void addMsg_RollsBackWhenStoreRejectsAuthor() throws SQLException {
    // Given: The store refuses the insert
    UserDTO author = user(9, "hank", Instant.EPOCH);
    DaoException missingAuthor = new DaoException(
        "Could not create message hi by hank.", "createMsg", ImmutableMap.of("authorId", 9L),
        Status.failedPrecondition("no such user", null));
    when(chatDAO.createMsg("hi", author, tx)).thenThrow(missingAuthor);

    // When/Then: The exception reaches the caller unchanged
    DaoException thrown =
        assertThrows(DaoException.class, () -> controller.addMsg("hi", author));
    assertSame(missingAuthor, thrown);

    // And: The transaction is closed without commit, which rolls it back
    verify(tx, never()).commit();
    verify(tx).close();
  }

  @Test
  void addMsg_RejectsMissingAuthorAsUserParameter() {
    ValidationException e =
        assertThrows(ValidationException.class, () -> controller.addMsg("hi", null));

    assertEquals("user", e.getParameterName());
    verifyNoInteractions(chatDAO);
  }

  @Test
  void passThroughs_RunInOwnTransactions() throws SQLException {
    UserDTO author = user(1, "ivy", Instant.EPOCH);
    MessageDTO msg = new MessageDTO(2, author, "hello", CREATED, CREATED, null);
    when(chatDAO.findMsgById(2, tx)).thenReturn(Optional.of(msg));
    when(chatDAO.findUserById(1, tx)).thenReturn(Optional.of(author));
    when(chatDAO.findAllMsgs(tx)).thenReturn(List.of(msg));
    when(chatDAO.deleteMsg(2, tx)).thenReturn(1);

    assertEquals(Optional.of(msg), controller.findMsg(2));
    assertEquals(Optional.of(author), controller.findUser(1));
    assertEquals(List.of(msg), controller.findAllMsgs());
    controller.deleteMsg(2);

    verify(database, times(4)).beginTransaction();
    verify(tx, times(4)).commit();
    verify(tx, times(4)).close();
  }

  @Test
  void findMsg_RejectsNonPositiveId() {
    ValidationException e = assertThrows(ValidationException.class, () -> controller.findMsg(0));

    assertEquals("msgId", e.getParameterName());
  }

  @Test
  void commitFailure_IsReportedAsDaoException() throws SQLException {
    when(chatDAO.findAllMsgs(tx)).thenReturn(List.of());
    doThrow(new SQLException("connection lost", "08006")).when(tx).commit();

    DaoException e = assertThrows(DaoException.class, () -> controller.findAllMsgs());

    assertEquals(StatusCode.UNAVAILABLE, e.getCode());
    assertEquals("findAllMsgs", e.getOperation());
    verify(tx).close();
  }

  @Test
  void beginFailure_IsReportedAsDaoException() throws SQLException {
    when(database.beginTransaction()).thenThrow(new SQLException("pool exhausted", "08001"));

    DaoException e = assertThrows(DaoException.class, () -> controller.findUser(1));

    assertEquals(StatusCode.UNAVAILABLE, e.getCode());
    verifyNoInteractions(chatDAO);
  }

  private static UserDTO user(long id, String username, Instant loggedInUntil) {
    return new UserDTO(id, username, loggedInUntil, CREATED, CREATED, null);
  }

  private static DaoException duplicate(String username) {
    return new DaoException(
        "Could not create user " + username + ".", "createUser",
        ImmutableMap.of("username", username),
        Status.alreadyExists("duplicate key", new SQLException("duplicate", "23505")));
  }
}
