package com.github.adamzv.proton.application;

import com.github.adamzv.proton.domain.Problems;
import com.github.adamzv.proton.ports.SchemaDecoderPort;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Decodes UTF-8 payloads as-is and rejects those starting with {@code bad}.
 */
final class TextDecoder implements SchemaDecoderPort {

  @Override
  public String decode(byte[] payload) {
    String text = new String(payload, StandardCharsets.UTF_8);
    if (text.startsWith("bad")) {
      throw Problems.decodeFailed("unexpected EOF", Map.of("size", payload.length), null);
    }
    return "{\"value\":\"" + text + "\"}";
  }
}
