package com.github.adamzv.proton.domain;

import java.util.Map;

public final class Problems {

  private Problems() {
  }

  public static ProblemException invalidArgument(String message, Map<String, Object> details) {
    return raise(ProblemCodes.INVALID_ARGUMENT, message, details, null);
  }

  public static ProblemException notFound(String message, Map<String, Object> details) {
    return raise(ProblemCodes.NOT_FOUND, message, details, null);
  }

  public static ProblemException kafkaUnavailable(String message, Map<String, Object> details) {
    return raise(ProblemCodes.KAFKA_UNAVAILABLE, message, details, null);
  }

  public static ProblemException operationFailed(String message, Map<String, Object> details) {
    return raise(ProblemCodes.OPERATION_FAILED, message, details, null);
  }

  public static ProblemException operationFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.OPERATION_FAILED, message, details, cause);
  }

  public static ProblemException resolutionFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.RESOLUTION_FAILED, message, details, cause);
  }

  public static ProblemException partitionUnavailable(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.PARTITION_UNAVAILABLE, message, details, cause);
  }

  public static ProblemException schemaInvalid(String message, Map<String, Object> details) {
    return raise(ProblemCodes.SCHEMA_INVALID, message, details, null);
  }

  public static ProblemException schemaInvalid(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.SCHEMA_INVALID, message, details, cause);
  }

  public static ProblemException decodeFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.DECODE_FAILED, message, details, cause);
  }

  public static ProblemException tokenTooLarge(String message, Map<String, Object> details) {
    return raise(ProblemCodes.TOKEN_TOO_LARGE, message, details, null);
  }

  private static ProblemException raise(String code, String message, Map<String, Object> details,
                                        Throwable cause) {
    return new ProblemException(new Problem(code, message, details), cause);
  }
}
