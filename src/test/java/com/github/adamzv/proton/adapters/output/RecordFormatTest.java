package com.github.adamzv.proton.adapters.output;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.github.adamzv.proton.domain.DecodedResult;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class RecordFormatTest {

  private static final DecodedResult.Decoded MESSAGE = new DecodedResult.Decoded(
      "my-key",
      "my-val",
      "my-topic",
      3,
      42L,
      Instant.ofEpochSecond(42, 123)
  );

  @Test
  void rendersEveryToken() {
    RecordFormat format = RecordFormat.parse(
        "Topic: %t, Key: %k, \\n\\rMsg: %s, \\tTimestamp: %T, Time: %Tf, At: %p/%o", ZoneOffset.UTC);

    assertEquals(
        "Topic: my-topic, Key: my-key, \n\rMsg: my-val, \tTimestamp: 42000, Time: 1970-01-01T00:00:42Z, At: 3/42",
        format.render(MESSAGE)
    );
  }

  @Test
  void defaultPatternPrefixesTimestamp() {
    RecordFormat format = RecordFormat.parse(null, ZoneOffset.UTC);

    assertEquals(RecordFormat.DEFAULT_PATTERN, format.pattern());
    assertEquals("1970-01-01T00:00:42Z: my-val", format.render(MESSAGE));
  }

  @Test
  void formattedTimestampUsesConfiguredZone() {
    RecordFormat format = RecordFormat.parse("%Tf", ZoneId.of("+02:00"));

    assertEquals("1970-01-01T02:00:42+02:00", format.render(MESSAGE));
  }

  @Test
  void substitutedValuesAreNotExpandedAgain() {
    DecodedResult.Decoded tricky = new DecodedResult.Decoded("%s", "%k", "t", 0, 0L, Instant.EPOCH);

    assertEquals("%s|%k", RecordFormat.parse("%k|%s", ZoneOffset.UTC).render(tricky));
  }

  @Test
  void unknownSequencesStayLiteral() {
    assertEquals("100% %x \\q my-val%",
        RecordFormat.parse("100% %x \\q %s%", ZoneOffset.UTC).render(MESSAGE));
  }
}
