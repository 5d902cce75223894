package com.catalog.user.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.catalog.user.model.User;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class JdbcUserRepositoryTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.flyway.enabled", () -> "true");
    registry.add("spring.flyway.locations", () -> "classpath:db/migration");
  }

  @Autowired private UserRepository userRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM users", new MapSqlParameterSource());
  }

  @Test
  void createThenGetIdReturnsGeneratedId() {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);

    final String id = userRepository.create(new User(null, "a@example.com", "shield", now, now));

    assertThat(id).isNotBlank();
    assertThat(userRepository.getId("a@example.com", "shield")).isEqualTo(id);
    final Optional<User> found = userRepository.findById(id);
    assertThat(found).isPresent();
    assertThat(found.get().email()).isEqualTo("a@example.com");
    assertThat(found.get().provider()).isEqualTo("shield");
    assertThat(found.get().createdAt()).isEqualTo(now);
  }

  @Test
  void getIdThrowsNotFoundForUnknownEmail() {
    assertThatThrownBy(() -> userRepository.getId("missing@example.com", "shield"))
        .isInstanceOf(UserNotFoundException.class);
  }

  @Test
  void getIdThrowsNotFoundForOtherProvider() {
    final Instant now = Instant.now();
    userRepository.create(new User(null, "b@example.com", "shield", now, now));

    assertThatThrownBy(() -> userRepository.getId("b@example.com", "okta"))
        .isInstanceOf(UserNotFoundException.class);
  }

  @Test
  void createRejectsDuplicateEmail() {
    final Instant now = Instant.now();
    userRepository.create(new User(null, "c@example.com", "shield", now, now));

    assertThatThrownBy(
            () -> userRepository.create(new User(null, "c@example.com", "shield", now, now)))
        .isInstanceOf(DuplicateUserException.class)
        .hasMessage("user already exists");
  }

  @Test
  void createUnderOtherProviderConflictsOnEmail() {
    final Instant now = Instant.now();
    userRepository.create(new User(null, "d@example.com", "shield", now, now));

    assertThatThrownBy(() -> userRepository.getId("d@example.com", "okta"))
        .isInstanceOf(UserNotFoundException.class);
    assertThatThrownBy(
            () -> userRepository.create(new User(null, "d@example.com", "okta", now, now)))
        .isInstanceOf(DuplicateUserException.class);
  }
}
