package com.github.adamzv.proton.domain;

public record ConsumeSettings(
    String topic,
    OffsetBound start,
    OffsetBound end,
    String keyPattern,
    boolean verbose
) {

  public static final String MATCH_ALL = ".*";

  public ConsumeSettings {
    start = start == null ? OffsetBound.OLDEST : start;
    end = end == null ? OffsetBound.NEWEST : end;
    keyPattern = keyPattern == null || keyPattern.isEmpty() ? MATCH_ALL : keyPattern;
  }
}
