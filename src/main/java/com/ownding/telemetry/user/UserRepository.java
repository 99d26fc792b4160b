package com.ownding.telemetry.user;

import com.ownding.telemetry.retention.UserTier;
import com.ownding.telemetry.retention.UserTierLookup;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

@Repository
public class UserRepository implements UserTierLookup {

    private static final RowMapper<UserAccount> USER_MAPPER = (rs, rowNum) -> new UserAccount(
            rs.getLong("id"),
            rs.getString("username"),
            rs.getString("email"),
            rs.getString("tier"),
            rs.getString("subscription_end"),
            nullableInt(rs, "cap_override"),
            rs.getString("created_at"),
            rs.getString("updated_at")
    );

    private final JdbcClient jdbcClient;

    public UserRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    public Optional<UserAccount> findUserById(long id) {
        return jdbcClient.sql("""
                        SELECT id, username, email, tier, subscription_end, cap_override, created_at, updated_at
                        FROM user_account
                        WHERE id = :id
                        LIMIT 1
                        """)
                .param("id", id)
                .query(USER_MAPPER)
                .optional();
    }

    public Optional<UserAccount> findUserByUsername(String username) {
        return jdbcClient.sql("""
                        SELECT id, username, email, tier, subscription_end, cap_override, created_at, updated_at
                        FROM user_account
                        WHERE username = :username
                        LIMIT 1
                        """)
                .param("username", username)
                .query(USER_MAPPER)
                .optional();
    }

    public UserAccount createUser(String username, String email, String tier) {
        String now = Instant.now().toString();
        Long id = jdbcClient.sql("""
                        INSERT INTO user_account (username, email, tier, created_at, updated_at)
                        VALUES (:username, :email, :tier, :now, :now)
                        RETURNING id
                        """)
                .param("username", username)
                .param("email", email)
                .param("tier", tier)
                .param("now", now)
                .query(Long.class)
                .single();
        return findUserById(id).orElseThrow();
    }

    public int updateTier(long id, String tier, String subscriptionEnd, Integer capOverride) {
        String now = Instant.now().toString();
        return jdbcClient.sql("""
                        UPDATE user_account
                        SET tier = :tier,
                            subscription_end = :subscriptionEnd,
                            cap_override = :capOverride,
                            updated_at = :now
                        WHERE id = :id
                        """)
                .param("tier", tier)
                .param("subscriptionEnd", subscriptionEnd)
                .param("capOverride", capOverride)
                .param("now", now)
                .param("id", id)
                .update();
    }

    @Override
    public Optional<UserTier> findUserTier(long userId) {
        return jdbcClient.sql("""
                        SELECT tier, subscription_end, cap_override
                        FROM user_account
                        WHERE id = :userId
                        """)
                .param("userId", userId)
                .query((rs, rowNum) -> {
                    return new UserTier(
                            rs.getString("tier"),
                            parseSubscriptionEnd(userId, rs.getString("subscription_end")),
                            nullableInt(rs, "cap_override"));
                })
                .optional();
    }

    private static Instant parseSubscriptionEnd(long userId, String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException ex) {
            throw new DataRetrievalFailureException(
                    "malformed subscription_end for user " + userId + ": " + raw, ex);
        }
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
