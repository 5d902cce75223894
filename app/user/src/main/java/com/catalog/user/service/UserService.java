package com.catalog.user.service;

import com.catalog.user.config.IdentityProperties;
import com.catalog.user.model.User;
import com.catalog.user.repository.UserNotFoundException;
import com.catalog.user.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UserService {

  private static final Logger logger = LoggerFactory.getLogger(UserService.class);

  private final UserRepository userRepository;
  private final IdentityProperties identityProperties;
  private final Clock clock;
  private final UserMetrics userMetrics;

  /**
   * 役割:
   * - email を既定 identity provider の内部 userId へ解決し、未登録なら作成する。
   *
   * 期待動作:
   * - 空文字以外の値は形式を問わずそのまま Repository へ渡す。
   * - Repository の例外は包まずに再送出し、同時作成で負けた側の重複もリトライしない。
   */
  public String resolveOrCreate(String email) {
    if (email == null || email.isEmpty()) {
      throw new IllegalArgumentException("email is required");
    }
    final String provider = identityProperties.providerDefaultName();
    try {
      return lookupOrCreate(email, provider);
    } catch (RuntimeException ex) {
      userMetrics.recordResolution("error");
      throw ex;
    }
  }

  private String lookupOrCreate(String email, String provider) {
    try {
      final String userId = userRepository.getId(email, provider);
      userMetrics.recordResolution("found");
      return userId;
    } catch (UserNotFoundException ex) {
      logger.debug("user not registered yet, creating for provider={}", provider);
    }

    final Instant now = Instant.now(clock);
    final String userId = userRepository.create(new User(null, email, provider, now, now));
    userMetrics.recordResolution("created");
    logger.info("registered new user for provider={}", provider);
    return userId;
  }
}
