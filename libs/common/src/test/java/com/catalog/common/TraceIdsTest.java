package com.catalog.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void orNewKeepsCallerSuppliedId() {
    assertThat(TraceIds.orNew("req-1")).isEqualTo("req-1");
  }

  @Test
  void orNewGeneratesUuidWhenBlank() {
    final String generated = TraceIds.orNew("  ");

    assertThat(UUID.fromString(generated).toString()).isEqualTo(generated);
    assertThat(TraceIds.orNew(null)).isNotBlank().isNotEqualTo(generated);
  }
}
