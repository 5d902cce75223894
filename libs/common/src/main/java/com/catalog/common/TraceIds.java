package com.catalog.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  // 呼び出し元が付与した ID があればそれを使い、なければ新規採番する
  public static String orNew(String candidate) {
    if (candidate != null && !candidate.isBlank()) {
      return candidate;
    }
    return newTraceId();
  }

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }
}
