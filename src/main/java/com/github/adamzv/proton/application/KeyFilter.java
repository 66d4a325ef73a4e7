package com.github.adamzv.proton.application;

import com.github.adamzv.proton.domain.ConsumeSettings;
import com.github.adamzv.proton.domain.Problems;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class KeyFilter {

  private final Pattern pattern;

  private KeyFilter(Pattern pattern) {
    this.pattern = pattern;
  }

  public static KeyFilter compile(String expression) {
    String value = expression == null || expression.isEmpty() ? ConsumeSettings.MATCH_ALL : expression;
    try {
      return new KeyFilter(Pattern.compile(value));
    } catch (PatternSyntaxException ex) {
      throw Problems.invalidArgument(
          "Invalid key pattern",
          Map.of("pattern", value, "error", ex.getDescription())
      );
    }
  }

  public boolean matches(byte[] key) {
    String text = key == null ? "" : new String(key, StandardCharsets.UTF_8);
    return pattern.matcher(text).find();
  }

  public String pattern() {
    return pattern.pattern();
  }
}
