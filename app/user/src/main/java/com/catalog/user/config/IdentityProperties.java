/*
 * どこで: User アプリの設定バインド
 * 何を: identity ヘッダー名と既定 identity provider 名、認証不要パスを保持する
 * なぜ: 起動時に一度だけ確定させ、Filter と Service へ同じ値を注入するため
 */
package com.catalog.user.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "user.identity")
public record IdentityProperties(
    @NotBlank String headerName, @NotBlank String providerDefaultName, List<String> publicPaths) {

  public IdentityProperties {
    publicPaths =
        publicPaths == null || publicPaths.isEmpty()
            ? List.of("/", "/error", "/actuator/health", "/actuator/health/**", "/actuator/info")
            : List.copyOf(publicPaths);
  }
}
