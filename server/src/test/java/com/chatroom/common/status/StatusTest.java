package com.chatroom.common.status;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/** Tests for Status and StatusOr. */
class StatusTest {

  @Test
  void testStatusCreation() {
    Status ok = Status.ok();
    assertTrue(ok.isOk());
    assertFalse(ok.isError());
    assertEquals(200, ok.getHttpCode());

    Status notFound = Status.notFound("Message not found");
    assertTrue(notFound.isError());
    assertEquals(StatusCode.NOT_FOUND, notFound.getCode());
    assertEquals("NOT_FOUND: Message not found", notFound.toString());

    Exception cause = new RuntimeException("boom");
    Status internal = Status.internal("Internal error", cause);
    assertEquals(StatusCode.INTERNAL, internal.getCode());
    assertSame(cause, internal.getCause());
  }

  @Test
  void testHttpCodes() {
    assertEquals(400, Status.invalidArgument("bad").getHttpCode());
    assertEquals(409, Status.alreadyExists("dup", null).getHttpCode());
    assertEquals(409, Status.failedPrecondition("fk", null).getHttpCode());
    assertEquals(409, Status.aborted("conflict", null).getHttpCode());
    assertEquals(503, Status.unavailable("down", null).getHttpCode());
    assertEquals(500, Status.internal("oops", null).getHttpCode());
  }

  @Test
  void testStatusOrWithValue() {
    StatusOr<String> statusOr = StatusOr.ofValue("test");
    assertTrue(statusOr.isOk());
    assertFalse(statusOr.isNotOk());
    assertEquals("test", statusOr.getValue());
    assertTrue(statusOr.getStatus().isOk());
  }

  @Test
  void testStatusOrWithError() {
    Status error = Status.invalidArgument("Invalid argument");
    StatusOr<String> statusOr = StatusOr.ofStatus(error);
    assertTrue(statusOr.isNotOk());
    assertEquals(error, statusOr.getStatus());
    assertThrows(IllegalStateException.class, statusOr::getValue);
    assertThrows(IllegalArgumentException.class, () -> StatusOr.ofStatus(Status.ok()));
  }

  @Test
  void testStatusOrFromException() {
    Exception exception = new RuntimeException("Test exception");
    StatusOr<String> statusOr = StatusOr.ofException(exception);
    assertEquals(StatusCode.INTERNAL, statusOr.getStatus().getCode());
    assertTrue(statusOr.getStatus().getMessage().contains("Test exception"));
    assertEquals(exception, statusOr.getStatus().getCause());
  }

  @Test
  void testStatusOrMap() {
    StatusOr<Integer> intStatusOr = StatusOr.ofValue(42);
    assertEquals("42", intStatusOr.map(String::valueOf).getValue());

    Status error = Status.notFound("gone");
    StatusOr<Integer> errorStatusOr = StatusOr.ofStatus(error);
    StatusOr<String> mapped = errorStatusOr.map(String::valueOf);
    assertFalse(mapped.isOk());
    assertEquals(error, mapped.getStatus());
  }
}
