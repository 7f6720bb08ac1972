package com.chatroom.db;

import com.chatroom.common.status.Status;
import com.chatroom.common.status.StatusOr;
import com.chatroom.db.util.DbUtil;
import com.chatroom.model.MessageDTO;
import com.chatroom.model.UserDTO;
import com.chatroom.util.ValidationException;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Row helper for the 'msgs' table. Reads join each message to its author and skip soft-deleted
 * messages.
 */
final class Msgs {

    /** Message columns followed by the author's columns, aliased with an {@code author_} prefix. */
    private static final String SELECT_WITH_AUTHOR = """
            SELECT m.id, m.msg, m.created_at, m.updated_at, m.deleted_at,
                   u.id              AS author_id,
                   u.username        AS author_username,
                   u.logged_in_until AS author_logged_in_until,
                   u.created_at      AS author_created_at,
                   u.updated_at      AS author_updated_at,
                   u.deleted_at      AS author_deleted_at
              FROM msgs m
              JOIN users u ON m.user_id = u.id
            """;

    private Msgs() {
        // Utility class
    }

    /**
     * Inserts a message written by {@code author}. The returned message carries the author as
     * passed in; it is not re-read.
     *
     * @param conn an open JDBC connection
     * @param text the message text
     * @param author the message author, referenced by id
     * @return StatusOr containing the inserted message or an error; FAILED_PRECONDITION if the
     *     author row does not exist
     */
    @Nonnull
    static StatusOr<MessageDTO> insert(Connection conn, String text, UserDTO author) {
        String sql = """
                INSERT INTO msgs (msg, user_id)
                VALUES (?, ?)
                RETURNING id, msg, created_at, updated_at, deleted_at
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, text);
            stmt.setLong(2, author.id());
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return StatusOr.ofStatus(Status.internal("Insert returned no row", null));
                }
                return extractMsg(rs, author);
            }
        } catch (SQLException e) {
            return DbUtil.failure(e, "Failed to create message by " + author.username());
        }
    }

    /**
     * Loads a single live message by ID, with its author.
     *
     * @param conn an open JDBC connection
     * @param id the id of the message
     * @return StatusOr containing an Optional message or an error
     */
    @Nonnull
    static StatusOr<Optional<MessageDTO>> loadById(Connection conn, long id) {
        String sql = SELECT_WITH_AUTHOR + """
                 WHERE m.id = ?
                   AND m.deleted_at IS NULL
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return extractMsgWithAuthor(rs).map(Optional::of);
                }
                return StatusOr.ofValue(Optional.empty());
            }
        } catch (SQLException e) {
            return DbUtil.failure(e, "Failed to search for message " + id);
        }
    }

    /**
     * Loads all live messages with their authors, oldest first.
     *
     * @param conn an open JDBC connection
     * @return StatusOr containing the messages (possibly empty) or an error
     */
    @Nonnull
    static StatusOr<List<MessageDTO>> loadAll(Connection conn) {
        String sql = SELECT_WITH_AUTHOR + """
                 WHERE m.deleted_at IS NULL
                 ORDER BY m.id
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            ImmutableList.Builder<MessageDTO> result = ImmutableList.builder();
            while (rs.next()) {
                StatusOr<MessageDTO> msgOr = extractMsgWithAuthor(rs);
                if (msgOr.isNotOk()) {
                    return StatusOr.ofStatus(msgOr.getStatus());
                }
                result.add(msgOr.getValue());
            }
            return StatusOr.ofValue(result.build());
        } catch (SQLException e) {
            return DbUtil.failure(e, "Failed to read messages");
        }
    }

    /**
     * Soft-deletes a message by setting deleted_at. Already deleted messages keep their original
     * deletion time.
     *
     * @param conn an open JDBC connection
     * @param id the id of the message
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    static StatusOr<Integer> softDelete(Connection conn, long id) {
        String sql = """
                UPDATE msgs
                   SET deleted_at = now(),
                       updated_at = now()
                 WHERE id = ?
                   AND deleted_at IS NULL
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, id);
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return DbUtil.failure(e, "Failed to delete message " + id);
        }
    }

    @Nonnull
    private static StatusOr<MessageDTO> extractMsgWithAuthor(ResultSet rs) throws SQLException {
        StatusOr<UserDTO> authorOr = Users.extractUser(rs, "author_");
        if (authorOr.isNotOk()) {
            return StatusOr.ofStatus(authorOr.getStatus());
        }
        return extractMsg(rs, authorOr.getValue());
    }

    /**
     * Extracts the message columns of the current row and pairs them with {@code author}.
     */
    @Nonnull
    private static StatusOr<MessageDTO> extractMsg(ResultSet rs, UserDTO author) throws SQLException {
        long id = rs.getLong("id");
        String text = rs.getString("msg");

        StatusOr<Instant> createdAtOr = DbUtil.getInstant(rs, "created_at");
        if (createdAtOr.isNotOk()) {
            return StatusOr.ofStatus(createdAtOr.getStatus());
        }

        StatusOr<Instant> updatedAtOr = DbUtil.getInstant(rs, "updated_at");
        if (updatedAtOr.isNotOk()) {
            return StatusOr.ofStatus(updatedAtOr.getStatus());
        }

        StatusOr<Optional<Instant>> deletedAtOr = DbUtil.getOptionalInstant(rs, "deleted_at");
        if (deletedAtOr.isNotOk()) {
            return StatusOr.ofStatus(deletedAtOr.getStatus());
        }

        try {
            return StatusOr.ofValue(new MessageDTO(
                    id,
                    author,
                    text,
                    createdAtOr.getValue(),
                    updatedAtOr.getValue(),
                    deletedAtOr.getValue().orElse(null)
            ));
        } catch (ValidationException e) {
            return StatusOr.ofStatus(Status.internal("Message row " + id + " is malformed: " + e.getMessage(), e));
        }
    }
}
