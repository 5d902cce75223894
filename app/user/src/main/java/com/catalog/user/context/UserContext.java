/*
 * どこで: app/user/src/main/java/com/catalog/user/context/UserContext.java
 * 何を: 解決済み userId をリクエスト属性として保持・参照する
 * なぜ: リクエストの寿命に閉じた受け渡しにし、並行リクエスト間で状態を共有しないため
 */
package com.catalog.user.context;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

public final class UserContext {

  public static final String REQUEST_ATTRIBUTE = UserContext.class.getName() + ".USER_ID";

  // 未解決のリクエストで currentUserId が返す値
  public static final String NONE = "";

  private UserContext() {}

  public static void attach(HttpServletRequest request, String userId) {
    request.setAttribute(REQUEST_ATTRIBUTE, userId);
  }

  public static String currentUserId(HttpServletRequest request) {
    return find(request).orElse(NONE);
  }

  public static Optional<String> find(HttpServletRequest request) {
    final Object value = request.getAttribute(REQUEST_ATTRIBUTE);
    if (value instanceof String userId && !userId.isEmpty()) {
      return Optional.of(userId);
    }
    return Optional.empty();
  }
}
