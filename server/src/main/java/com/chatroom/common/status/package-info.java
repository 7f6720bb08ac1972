/**
 * Status values for the data layer.
 *
 * <ul>
 *   <li>{@link com.chatroom.common.status.StatusCode} - the error taxonomy, with the HTTP code
 *       each maps to
 *   <li>{@link com.chatroom.common.status.Status} - a code with an optional message and cause
 *   <li>{@link com.chatroom.common.status.StatusOr} - either a value or a non-OK status
 * </ul>
 *
 * <p>Row helpers return {@code StatusOr}; the DAO turns a failed one into a
 * {@link com.chatroom.db.DaoException} that carries the status, so callers above the DAO deal
 * with exceptions only.
 */
package com.chatroom.common.status;
