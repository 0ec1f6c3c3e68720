package com.flamingo.ai.legalreport.service.text;

import java.text.Normalizer;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/** Accent-, case- and whitespace-insensitive normal form for Spanish legal text. */
public final class TextNormalizer {

  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TextNormalizer() {}

  public static String normalize(String text) {
    if (text == null) {
      return "";
    }
    String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
    String withoutAccents = COMBINING_MARKS.matcher(decomposed).replaceAll("");
    return WHITESPACE.matcher(withoutAccents.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
  }

  public static boolean isBlank(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof String s) {
      return s.isBlank();
    }
    if (value instanceof Collection<?> c) {
      return c.isEmpty();
    }
    if (value instanceof Map<?, ?> m) {
      return m.isEmpty();
    }
    return false;
  }
}
