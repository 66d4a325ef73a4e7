package com.github.adamzv.proton.domain;

import java.time.Instant;

public record ConsumedMessage(
    byte[] key,
    byte[] payload,
    int partition,
    long offset,
    Instant timestamp
) {}
