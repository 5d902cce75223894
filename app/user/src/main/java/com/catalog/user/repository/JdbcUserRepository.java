package com.catalog.user.repository;

import com.catalog.common.JdbcTimestampUtils;
import com.catalog.user.model.User;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class JdbcUserRepository implements UserRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public String getId(String email, String provider) {
    final String sql =
        """
        SELECT id
        FROM users
        WHERE email = :email AND provider = :provider
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("email", email).addValue("provider", provider);
    return jdbcTemplate.queryForList(sql, params, String.class).stream()
        .findFirst()
        .orElseThrow(UserNotFoundException::new);
  }

  @Override
  public String create(@NonNull User user) {
    final String sql =
        """
        INSERT INTO users (id, email, provider, created_at, updated_at)
        VALUES (:id, :email, :provider, :createdAt, :updatedAt)
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", UUID.randomUUID().toString())
            .addValue("email", user.email())
            .addValue("provider", user.provider())
            .addValue("createdAt", JdbcTimestampUtils.toTimestamp(user.createdAt()))
            .addValue("updatedAt", JdbcTimestampUtils.toTimestamp(user.updatedAt()));
    try {
      return jdbcTemplate.queryForObject(sql, params, String.class);
    } catch (DuplicateKeyException ex) {
      throw new DuplicateUserException(ex);
    }
  }

  @Override
  public Optional<User> findById(String id) {
    final String sql =
        """
        SELECT id, email, provider, created_at, updated_at
        FROM users
        WHERE id = :id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private User mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new User(
        rs.getString("id"),
        rs.getString("email"),
        rs.getString("provider"),
        JdbcTimestampUtils.toInstant(rs.getTimestamp("created_at")),
        JdbcTimestampUtils.toInstant(rs.getTimestamp("updated_at")));
  }
}
