package com.catalog.user.context;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class UserContextTest {

  @Test
  void returnsSentinelWhenNothingWasAttached() {
    final MockHttpServletRequest request = new MockHttpServletRequest();

    assertThat(UserContext.currentUserId(request)).isEqualTo(UserContext.NONE);
    assertThat(UserContext.find(request)).isEmpty();
  }

  @Test
  void returnsAttachedUserId() {
    final MockHttpServletRequest request = new MockHttpServletRequest();

    UserContext.attach(request, "user-1");

    assertThat(UserContext.currentUserId(request)).isEqualTo("user-1");
    assertThat(UserContext.find(request)).contains("user-1");
  }

  @Test
  void contextIsScopedToItsOwnRequest() {
    final MockHttpServletRequest first = new MockHttpServletRequest();
    final MockHttpServletRequest second = new MockHttpServletRequest();

    UserContext.attach(first, "user-1");

    assertThat(UserContext.currentUserId(second)).isEqualTo(UserContext.NONE);
  }
}
