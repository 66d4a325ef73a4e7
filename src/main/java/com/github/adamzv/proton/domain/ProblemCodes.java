package com.github.adamzv.proton.domain;

public final class ProblemCodes {
  public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
  public static final String NOT_FOUND = "NOT_FOUND";
  public static final String KAFKA_UNAVAILABLE = "KAFKA_UNAVAILABLE";
  public static final String OPERATION_FAILED = "OPERATION_FAILED";
  public static final String RESOLUTION_FAILED = "RESOLUTION_FAILED";
  public static final String PARTITION_UNAVAILABLE = "PARTITION_UNAVAILABLE";
  public static final String SCHEMA_INVALID = "SCHEMA_INVALID";
  public static final String DECODE_FAILED = "DECODE_FAILED";
  public static final String TOKEN_TOO_LARGE = "TOKEN_TOO_LARGE";

  private ProblemCodes() {
  }
}
