package com.github.adamzv.proton.domain;

import java.util.Map;

public record Offset(long value) {

  private static final long OLDEST_VALUE = -2L;
  private static final long NEWEST_VALUE = -1L;

  public static final Offset OLDEST = new Offset(OLDEST_VALUE);
  public static final Offset NEWEST = new Offset(NEWEST_VALUE);

  public Offset {
    if (value < 0 && value != OLDEST_VALUE && value != NEWEST_VALUE) {
      throw Problems.invalidArgument("Offset must be non-negative", Map.of("offset", value));
    }
  }

  public static Offset of(long value) {
    if (value < 0) {
      throw Problems.invalidArgument("Offset must be non-negative", Map.of("offset", value));
    }
    return new Offset(value);
  }

  public boolean isConcrete() {
    return value >= 0;
  }

  public boolean isOldest() {
    return value == OLDEST_VALUE;
  }

  public boolean isNewest() {
    return value == NEWEST_VALUE;
  }

  @Override
  public String toString() {
    if (isOldest()) {
      return "<start>";
    }
    if (isNewest()) {
      return "<end>";
    }
    return Long.toString(value);
  }
}
