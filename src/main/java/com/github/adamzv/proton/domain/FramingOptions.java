package com.github.adamzv.proton.domain;

import java.util.Map;

public record FramingOptions(
    byte[] startMarker,
    byte[] endMarker,
    int maxTokenSize
) {

  public static final int DEFAULT_MAX_TOKEN_SIZE = 64 * 1024;

  public FramingOptions {
    startMarker = startMarker == null ? new byte[0] : startMarker;
    endMarker = endMarker == null ? new byte[0] : endMarker;
    if (maxTokenSize <= 0) {
      throw Problems.invalidArgument("Maximum token size must be positive", Map.of("maxTokenSize", maxTokenSize));
    }
  }

  public static FramingOptions endMarkerOnly(byte[] endMarker) {
    return new FramingOptions(null, endMarker, DEFAULT_MAX_TOKEN_SIZE);
  }

  public static FramingOptions startAndEnd(byte[] startMarker, byte[] endMarker) {
    return new FramingOptions(startMarker, endMarker, DEFAULT_MAX_TOKEN_SIZE);
  }

  public boolean hasStartMarker() {
    return startMarker.length > 0;
  }

  public boolean hasEndMarker() {
    return endMarker.length > 0;
  }
}
