package com.flamingo.ai.legalreport.service.comparison;

import com.flamingo.ai.legalreport.config.LegalPipelineConfig;
import com.flamingo.ai.legalreport.domain.enums.LegalField;
import com.flamingo.ai.legalreport.domain.enums.ValueKind;
import com.flamingo.ai.legalreport.service.text.TextNormalizer;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decides whether two extracted values say the same thing. Text is compared trimmed,
 * whitespace-collapsed, case- and accent-insensitive; money as parsed amounts within a tolerance;
 * lists as sorted multisets of normalized elements. Null and blank are equal.
 */
@Component
@RequiredArgsConstructor
public class FieldValueNormalizer {

  private final LegalPipelineConfig config;

  public boolean equivalent(String field, Object left, Object right) {
    boolean leftBlank = TextNormalizer.isBlank(left) || normalizeScalar(left).isEmpty();
    boolean rightBlank = TextNormalizer.isBlank(right) || normalizeScalar(right).isEmpty();
    if (leftBlank || rightBlank) {
      return leftBlank && rightBlank;
    }

    ValueKind kind = LegalField.fromKey(field).map(LegalField::kind).orElse(ValueKind.TEXT);
    if (kind == ValueKind.LIST || left instanceof Collection || right instanceof Collection) {
      return multiset(left).equals(multiset(right));
    }
    if (kind == ValueKind.MONEY) {
      Optional<MonetaryAmount> leftAmount = MonetaryAmount.parse(left);
      Optional<MonetaryAmount> rightAmount = MonetaryAmount.parse(right);
      if (leftAmount.isPresent() && rightAmount.isPresent()) {
        return leftAmount
            .get()
            .matches(rightAmount.get(), config.getComparison().getMonetaryTolerance());
      }
    }
    return normalizeScalar(left).equals(normalizeScalar(right));
  }

  List<String> multiset(Object value) {
    Collection<?> elements = value instanceof Collection<?> c ? c : List.of(value);
    return elements.stream()
        .map(FieldValueNormalizer::normalizeScalar)
        .filter(s -> !s.isEmpty())
        .sorted()
        .toList();
  }

  static String normalizeScalar(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, String> sorted = new TreeMap<>();
      map.forEach((k, v) -> sorted.put(String.valueOf(k), normalizeScalar(v)));
      return sorted.entrySet().stream()
          .map(e -> e.getKey() + "=" + e.getValue())
          .collect(Collectors.joining(";"));
    }
    if (value instanceof Collection<?> collection) {
      return collection.stream()
          .map(FieldValueNormalizer::normalizeScalar)
          .sorted()
          .collect(Collectors.joining(","));
    }
    return TextNormalizer.normalize(String.valueOf(value));
  }
}
