package com.github.adamzv.proton.domain;

import java.time.Instant;
import java.util.Map;

public record OffsetBound(Kind kind, long timestampMillis) {

  public enum Kind {
    OLDEST,
    NEWEST,
    TIMESTAMP
  }

  public static final OffsetBound OLDEST = new OffsetBound(Kind.OLDEST, 0L);
  public static final OffsetBound NEWEST = new OffsetBound(Kind.NEWEST, 0L);

  public OffsetBound {
    if (kind == null) {
      throw Problems.invalidArgument("Offset bound kind is required", Map.of());
    }
    if (kind == Kind.TIMESTAMP && timestampMillis < 0) {
      throw Problems.invalidArgument("Timestamp must be non-negative", Map.of("timestamp", timestampMillis));
    }
  }

  public static OffsetBound at(long timestampMillis) {
    return new OffsetBound(Kind.TIMESTAMP, timestampMillis);
  }

  public static OffsetBound at(Instant instant) {
    return at(instant.toEpochMilli());
  }

  public boolean isTimestamp() {
    return kind == Kind.TIMESTAMP;
  }

  public Offset sentinel() {
    return switch (kind) {
      case OLDEST -> Offset.OLDEST;
      case NEWEST -> Offset.NEWEST;
      case TIMESTAMP -> throw new IllegalStateException("Timestamp bound has no sentinel offset");
    };
  }

  @Override
  public String toString() {
    return isTimestamp() ? "timestamp:" + timestampMillis : kind.name().toLowerCase();
  }
}
