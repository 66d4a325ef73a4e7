package com.github.adamzv.proton.support;

import com.github.adamzv.proton.domain.FramingOptions;
import jakarta.validation.constraints.Positive;
import java.nio.charset.StandardCharsets;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "framing")
public record FramingProperties(
    String startMarker,
    String endMarker,
    @Positive(message = "framing.maxTokenSize must be > 0")
    @DefaultValue("65536")
    int maxTokenSize,
    String input
) {

  public FramingOptions toDomain() {
    return new FramingOptions(bytes(startMarker), bytes(endMarker), maxTokenSize);
  }

  private static byte[] bytes(String marker) {
    return marker == null ? new byte[0] : marker.getBytes(StandardCharsets.UTF_8);
  }
}
