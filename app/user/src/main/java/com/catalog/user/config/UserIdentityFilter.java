/*
 * どこで: app/user/src/main/java/com/catalog/user/config/UserIdentityFilter.java
 * 何を: identity ヘッダーを必須とし、内部 userId へ解決してからハンドラへ渡す
 * なぜ: 保護対象の全ルートで同じ解決結果とエラー契約(400/500)を保証するため
 */
package com.catalog.user.config;

import com.catalog.user.api.ErrorResponse;
import com.catalog.user.context.UserContext;
import com.catalog.user.service.UserMetrics;
import com.catalog.user.service.UserService;
import com.catalog.user.service.UserValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

public class UserIdentityFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(UserIdentityFilter.class);
  private static final String USER_ROLE = "ROLE_USER";
  static final String EMPTY_IDENTITY_REASON = "identity header is empty";

  private final IdentityProperties properties;
  private final UserService userService;
  private final ObjectMapper objectMapper;
  private final UserMetrics userMetrics;
  private final AntPathMatcher pathMatcher = new AntPathMatcher();

  public UserIdentityFilter(
      IdentityProperties properties,
      UserService userService,
      ObjectMapper objectMapper,
      UserMetrics userMetrics) {
    this.properties = properties;
    this.userService = userService;
    this.objectMapper = objectMapper;
    this.userMetrics = userMetrics;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String path = request.getRequestURI();
    return path != null && isPublicPath(path, properties.publicPaths());
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String email = request.getHeader(properties.headerName());
    if (email == null || email.isEmpty()) {
      logger.warn(
          "request rejected: missing identity header {} on path={}",
          properties.headerName(),
          request.getRequestURI());
      reject(
          response,
          new UserValidationException(
              UserValidationException.Reason.EMPTY_IDENTITY, EMPTY_IDENTITY_REASON));
      return;
    }

    final String userId;
    try {
      userId = userService.resolveOrCreate(email);
    } catch (RuntimeException ex) {
      // 例外の連鎖には DB 由来の詳細(ヘッダー値を含む)が入り得るため、型名だけを残す
      logger.warn(
          "user resolution failed on path={} cause={}",
          request.getRequestURI(),
          ex.getClass().getName());
      reject(
          response,
          new UserValidationException(
              UserValidationException.Reason.BACKEND, nullToEmpty(ex.getMessage()), ex));
      return;
    }

    UserContext.attach(request, userId);
    SecurityContextHolder.getContext()
        .setAuthentication(
            new UsernamePasswordAuthenticationToken(
                userId, "N/A", List.of(new SimpleGrantedAuthority(USER_ROLE))));
    filterChain.doFilter(request, response);
  }

  private void reject(HttpServletResponse response, UserValidationException ex)
      throws IOException {
    final HttpStatus status =
        switch (ex.reason()) {
          case EMPTY_IDENTITY -> HttpStatus.BAD_REQUEST;
          case BACKEND -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    userMetrics.recordRejection(ex.reason());
    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    objectMapper.writeValue(response.getOutputStream(), new ErrorResponse(ex.getMessage()));
  }

  private boolean isPublicPath(String path, List<String> patterns) {
    for (String pattern : patterns) {
      if (pathMatcher.match(pattern, path)) {
        return true;
      }
    }
    return false;
  }

  private String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
