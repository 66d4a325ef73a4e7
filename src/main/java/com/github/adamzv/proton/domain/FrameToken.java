package com.github.adamzv.proton.domain;

public record FrameToken(byte[] bytes, Kind kind) {

  public enum Kind {
    LITERAL,
    FRAMED
  }

  public static FrameToken literal(byte[] bytes) {
    return new FrameToken(bytes, Kind.LITERAL);
  }

  public static FrameToken framed(byte[] bytes) {
    return new FrameToken(bytes, Kind.FRAMED);
  }

  public boolean isFramed() {
    return kind == Kind.FRAMED;
  }
}
