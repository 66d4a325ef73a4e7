package com.github.adamzv.proton.domain;

import java.time.Instant;

public sealed interface DecodedResult permits DecodedResult.Decoded, DecodedResult.DecodeError {

  String topic();

  int partition();

  long offset();

  record Decoded(
      String key,
      String text,
      String topic,
      int partition,
      long offset,
      Instant timestamp
  ) implements DecodedResult {}

  record DecodeError(
      String topic,
      int partition,
      long offset,
      Throwable cause
  ) implements DecodedResult {}
}
