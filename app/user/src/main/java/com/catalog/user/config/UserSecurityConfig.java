package com.catalog.user.config;

import com.catalog.user.service.UserMetrics;
import com.catalog.user.service.UserService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
@EnableConfigurationProperties(IdentityProperties.class)
public class UserSecurityConfig {

  @Bean
  UserIdentityFilter userIdentityFilter(
      IdentityProperties properties,
      UserService userService,
      ObjectMapper objectMapper,
      UserMetrics userMetrics) {
    return new UserIdentityFilter(properties, userService, objectMapper, userMetrics);
  }

  // Security チェーン内でのみ動かし、サーブレットフィルタとしての二重登録を防ぐ
  @Bean
  FilterRegistrationBean<UserIdentityFilter> userIdentityFilterRegistration(
      UserIdentityFilter userIdentityFilter) {
    final FilterRegistrationBean<UserIdentityFilter> registration =
        new FilterRegistrationBean<>(userIdentityFilter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http, UserIdentityFilter userIdentityFilter, IdentityProperties properties)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(userIdentityFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(properties.publicPaths().toArray(String[]::new))
                    .permitAll()
                    .anyRequest()
                    .authenticated());
    return http.build();
  }
}
