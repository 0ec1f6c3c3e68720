package com.flamingo.ai.legalreport.service.comparison;

import com.flamingo.ai.legalreport.service.text.TextNormalizer;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An amount written in Chilean notation: {@code .} groups thousands and {@code ,} starts the
 * decimals, as in {@code $ 1.000.000,50}. Unit is CLP unless the text names UF or US dollars.
 */
public record MonetaryAmount(BigDecimal amount, String currency) {

  private static final Pattern NUMBER =
      Pattern.compile("\\d{1,3}(?:\\.\\d{3})+(?:,\\d+)?|\\d+(?:,\\d+)?");
  private static final Pattern UF = Pattern.compile("\\bu\\.?f\\.?\\b|unidades de fomento");
  private static final Pattern USD = Pattern.compile("us\\$|\\busd\\b|dolares");

  public static Optional<MonetaryAmount> parse(Object value) {
    if (value == null) {
      return Optional.empty();
    }
    String text = value.toString();
    Matcher number = NUMBER.matcher(text);
    if (!number.find()) {
      return Optional.empty();
    }
    String digits = number.group().replace(".", "").replace(',', '.');
    return Optional.of(new MonetaryAmount(new BigDecimal(digits), currencyOf(text)));
  }

  /** Same currency and an absolute difference not above {@code tolerance}. */
  public boolean matches(MonetaryAmount other, double tolerance) {
    if (!currency.equals(other.currency)) {
      return false;
    }
    return amount.subtract(other.amount).abs().compareTo(BigDecimal.valueOf(tolerance)) <= 0;
  }

  private static String currencyOf(String text) {
    String normalized = TextNormalizer.normalize(text);
    if (USD.matcher(normalized).find()) {
      return "USD";
    }
    if (UF.matcher(normalized).find()) {
      return "UF";
    }
    return "CLP";
  }
}
