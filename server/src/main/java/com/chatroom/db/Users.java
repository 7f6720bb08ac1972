package com.chatroom.db;

import com.chatroom.common.status.Status;
import com.chatroom.common.status.StatusOr;
import com.chatroom.db.util.DbUtil;
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
 * Row helper for the 'users' table. Soft-deleted rows are invisible to every read.
 */
final class Users {

    private Users() {
        // Utility class
    }

    /**
     * Loads the live users with the given username.
     *
     * @param conn an open JDBC connection
     * @param username the username to match exactly
     * @return StatusOr containing the matching users (possibly empty) or an error
     */
    @Nonnull
    static StatusOr<List<UserDTO>> loadByUsername(Connection conn, String username) {
        String sql = """
                SELECT id, username, logged_in_until, created_at, updated_at, deleted_at
                  FROM users
                 WHERE username = ?
                   AND deleted_at IS NULL
                 ORDER BY id
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, username);
            try (ResultSet rs = stmt.executeQuery()) {
                ImmutableList.Builder<UserDTO> result = ImmutableList.builder();
                while (rs.next()) {
                    StatusOr<UserDTO> userOr = extractUser(rs, "");
                    if (userOr.isNotOk()) {
                        return StatusOr.ofStatus(userOr.getStatus());
                    }
                    result.add(userOr.getValue());
                }
                return StatusOr.ofValue(result.build());
            }
        } catch (SQLException e) {
            return DbUtil.failure(e, "Failed to search for user " + username);
        }
    }

    /**
     * Loads a single live user by ID.
     *
     * @param conn an open JDBC connection
     * @param id the id of the user to load
     * @return StatusOr containing an Optional user or an error
     */
    @Nonnull
    static StatusOr<Optional<UserDTO>> loadById(Connection conn, long id) {
        String sql = """
                SELECT id, username, logged_in_until, created_at, updated_at, deleted_at
                  FROM users
                 WHERE id = ?
                   AND deleted_at IS NULL
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return extractUser(rs, "").map(Optional::of);
                }
                return StatusOr.ofValue(Optional.empty());
            }
        } catch (SQLException e) {
            return DbUtil.failure(e, "Failed to search for user " + id);
        }
    }

    /**
     * Inserts a new user. The id, the timestamps and the session expiry (the epoch) come from the
     * column defaults.
     *
     * @param conn an open JDBC connection
     * @param username the username of the new user
     * @return StatusOr containing the inserted user or an error; ALREADY_EXISTS if a live user
     *     already has this username
     */
    @Nonnull
    static StatusOr<UserDTO> insert(Connection conn, String username) {
        String sql = """
                INSERT INTO users (username)
                VALUES (?)
                RETURNING id, username, logged_in_until, created_at, updated_at, deleted_at
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, username);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return StatusOr.ofStatus(Status.internal("Insert returned no row", null));
                }
                return extractUser(rs, "");
            }
        } catch (SQLException e) {
            return DbUtil.failure(e, "Failed to create user " + username);
        }
    }

    /**
     * Writes the username and session expiry of the given user and bumps updated_at.
     *
     * @param conn an open JDBC connection
     * @param user the new state of the user, matched by id
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    static StatusOr<Integer> update(Connection conn, UserDTO user) {
        String sql = """
                UPDATE users
                   SET username        = ?,
                       logged_in_until = ?,
                       updated_at      = now()
                 WHERE id = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, user.username());
            stmt.setTimestamp(2, DbUtil.toSqlTimestamp(user.loggedInUntil()));
            stmt.setLong(3, user.id());
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return DbUtil.failure(e, "Failed to update user " + user.username());
        }
    }

    /**
     * Extracts a user from the current row. {@code prefix} is prepended to every column label, so
     * the same code reads a plain select and the aliased author columns of a message join.
     */
    @Nonnull
    static StatusOr<UserDTO> extractUser(ResultSet rs, String prefix) throws SQLException {
        long id = rs.getLong(prefix + "id");
        String username = rs.getString(prefix + "username");

        // Rows written outside this code may lack an expiry; treat them as never logged in.
        StatusOr<Optional<Instant>> loggedInUntilOr =
                DbUtil.getOptionalInstant(rs, prefix + "logged_in_until");
        if (loggedInUntilOr.isNotOk()) {
            return StatusOr.ofStatus(loggedInUntilOr.getStatus());
        }

        StatusOr<Instant> createdAtOr = DbUtil.getInstant(rs, prefix + "created_at");
        if (createdAtOr.isNotOk()) {
            return StatusOr.ofStatus(createdAtOr.getStatus());
        }

        StatusOr<Instant> updatedAtOr = DbUtil.getInstant(rs, prefix + "updated_at");
        if (updatedAtOr.isNotOk()) {
            return StatusOr.ofStatus(updatedAtOr.getStatus());
        }

        StatusOr<Optional<Instant>> deletedAtOr = DbUtil.getOptionalInstant(rs, prefix + "deleted_at");
        if (deletedAtOr.isNotOk()) {
            return StatusOr.ofStatus(deletedAtOr.getStatus());
        }

        try {
            return StatusOr.ofValue(new UserDTO(
                    id,
                    username,
                    loggedInUntilOr.getValue().orElse(Instant.EPOCH),
                    createdAtOr.getValue(),
                    updatedAtOr.getValue(),
                    deletedAtOr.getValue().orElse(null)
            ));
        } catch (ValidationException e) {
            return StatusOr.ofStatus(Status.internal("User row " + id + " is malformed: " + e.getMessage(), e));
        }
    }
}
