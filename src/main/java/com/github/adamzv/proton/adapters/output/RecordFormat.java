package com.github.adamzv.proton.adapters.output;

import com.github.adamzv.proton.domain.DecodedResult;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * A kcat-like record format.
 *
 * <pre>
 *   %s   message payload
 *   %k   message key
 *   %t   topic
 *   %p   partition
 *   %o   offset
 *   %T   message timestamp, milliseconds since epoch
 *   %Tf  message timestamp as RFC 3339
 *   \n \r \t  newline, carriage return, tab
 * </pre>
 *
 * The pattern is parsed once; substituted values are never scanned for tokens again.
 */
public final class RecordFormat {

  public static final String DEFAULT_PATTERN = "%Tf: %s";

  private final String pattern;
  private final List<Function<DecodedResult.Decoded, String>> segments;

  private RecordFormat(String pattern, List<Function<DecodedResult.Decoded, String>> segments) {
    this.pattern = pattern;
    this.segments = segments;
  }

  public static RecordFormat parse(String pattern, ZoneId zone) {
    String value = pattern == null || pattern.isEmpty() ? DEFAULT_PATTERN : pattern;
    DateTimeFormatter rfc3339 = DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(zone);

    List<Function<DecodedResult.Decoded, String>> segments = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < value.length()) {
      char c = value.charAt(i);
      char next = i + 1 < value.length() ? value.charAt(i + 1) : 0;

      if (c == '\\' && (next == 'n' || next == 'r' || next == 't')) {
        literal.append(next == 'n' ? '\n' : next == 'r' ? '\r' : '\t');
        i += 2;
        continue;
      }
      if (c != '%') {
        literal.append(c);
        i++;
        continue;
      }

      Function<DecodedResult.Decoded, String> field;
      int width = 2;
      switch (next) {
        case 's' -> field = DecodedResult.Decoded::text;
        case 'k' -> field = DecodedResult.Decoded::key;
        case 't' -> field = DecodedResult.Decoded::topic;
        case 'p' -> field = msg -> Integer.toString(msg.partition());
        case 'o' -> field = msg -> Long.toString(msg.offset());
        case 'T' -> {
          if (i + 2 < value.length() && value.charAt(i + 2) == 'f') {
            field = msg -> rfc3339.format(msg.timestamp().truncatedTo(ChronoUnit.SECONDS));
            width = 3;
          } else {
            field = msg -> Long.toString(msg.timestamp().toEpochMilli());
          }
        }
        default -> field = null;
      }

      if (field == null) {
        literal.append(c);
        i++;
        continue;
      }
      if (literal.length() > 0) {
        String text = literal.toString();
        segments.add(msg -> text);
        literal.setLength(0);
      }
      segments.add(field);
      i += width;
    }
    if (literal.length() > 0) {
      String text = literal.toString();
      segments.add(msg -> text);
    }

    return new RecordFormat(value, List.copyOf(segments));
  }

  public String render(DecodedResult.Decoded message) {
    StringBuilder out = new StringBuilder();
    for (Function<DecodedResult.Decoded, String> segment : segments) {
      out.append(segment.apply(message));
    }
    return out.toString();
  }

  public String pattern() {
    return pattern;
  }
}
