package com.github.adamzv.proton.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Problem(
    String code,
    String message,
    Map<String, Object> details
) {

  public Problem {
    details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }
}
