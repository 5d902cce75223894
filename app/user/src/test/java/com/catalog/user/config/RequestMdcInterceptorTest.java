package com.catalog.user.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.catalog.user.context.UserContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putAndRemoveMdcValuesAroundRequestLifecycle() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1beta1/me");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    request.addHeader("Columbus-User-ID", "a@example.com");
    UserContext.attach(request, "user-1");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("GET");
    assertThat(MDC.get("http_path")).isEqualTo("/v1beta1/me");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");
    assertThat(MDC.getCopyOfContextMap()).doesNotContainValue("a@example.com");
    assertThat(MDC.getCopyOfContextMap()).doesNotContainValue("user-1");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("http_path")).isNull();
  }

  @Test
  void generatesRequestIdWhenHeaderIsMissing() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1beta1/me");
    request.setRemoteAddr("192.0.2.1");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("client_ip")).isEqualTo("192.0.2.1");
  }
}
