package com.github.adamzv.proton.adapters.cli;

import com.github.adamzv.proton.domain.OffsetBound;
import com.github.adamzv.proton.domain.Problems;
import java.util.List;
import java.util.Map;

public final class OffsetArguments {

  static final String START_PREFIX = "s@";
  static final String END_PREFIX = "e@";

  private OffsetArguments() {
  }

  public record Bounds(OffsetBound start, OffsetBound end) {}

  public static Bounds parse(List<String> offsets) {
    List<String> values = offsets == null ? List.of() : offsets;
    for (String value : values) {
      if (value == null || !(value.startsWith(START_PREFIX) || value.startsWith(END_PREFIX))) {
        throw Problems.invalidArgument(
            "Unsupported offset argument, expected s@<millis> or e@<millis>",
            Map.of("offset", String.valueOf(value))
        );
      }
    }
    return new Bounds(
        parse(START_PREFIX, values, OffsetBound.OLDEST),
        parse(END_PREFIX, values, OffsetBound.NEWEST)
    );
  }

  private static OffsetBound parse(String prefix, List<String> values, OffsetBound fallback) {
    for (String value : values) {
      if (!value.startsWith(prefix)) {
        continue;
      }
      String millis = value.substring(prefix.length()).trim();
      try {
        long parsed = Long.parseLong(millis);
        if (parsed < 0) {
          throw Problems.invalidArgument("Timestamp must be non-negative", Map.of("offset", value));
        }
        return OffsetBound.at(parsed);
      } catch (NumberFormatException ex) {
        throw Problems.invalidArgument("Timestamp must be a number of milliseconds", Map.of("offset", value));
      }
    }
    return fallback;
  }
}
