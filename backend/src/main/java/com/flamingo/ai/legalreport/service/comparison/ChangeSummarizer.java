package com.flamingo.ai.legalreport.service.comparison;

import com.flamingo.ai.legalreport.domain.enums.ChangeCategory;
import com.flamingo.ai.legalreport.domain.model.FieldChange;
import com.flamingo.ai.legalreport.service.text.TextNormalizer;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Spanish wording for field changes and for the one-sentence summary of a version pair. */
@Component
public class ChangeSummarizer {

  public String statement(String label, Object oldValue, Object newValue) {
    if (TextNormalizer.isBlank(oldValue)) {
      return label + ": se incorpora " + render(newValue);
    }
    if (TextNormalizer.isBlank(newValue)) {
      return label + ": se elimina " + render(oldValue);
    }
    return label + ": de " + render(oldValue) + " a " + render(newValue);
  }

  /**
   * One sentence naming the changed categories, most significant first.
   *
   * @param fromVersion the older version of the pair
   * @param changes the pair's changes, possibly empty
   */
  public String summarize(int fromVersion, List<FieldChange> changes) {
    int toVersion = fromVersion + 1;
    if (changes.isEmpty()) {
      return "Sin cambios significativos entre la versión "
          + fromVersion
          + " y la versión "
          + toVersion
          + ".";
    }
    List<String> categories =
        changes.stream()
            .map(FieldChange::category)
            .distinct()
            .sorted()
            .map(ChangeCategory::description)
            .toList();
    String noun = changes.size() == 1 ? "cambio" : "cambios";
    return "Entre la versión "
        + fromVersion
        + " y la versión "
        + toVersion
        + " se modifica "
        + joinSpanish(categories)
        + " ("
        + changes.size()
        + " "
        + noun
        + ").";
  }

  static String joinSpanish(List<String> parts) {
    if (parts.size() == 1) {
      return parts.get(0);
    }
    return String.join(", ", parts.subList(0, parts.size() - 1))
        + " y "
        + parts.get(parts.size() - 1);
  }

  private static String render(Object value) {
    if (value instanceof Collection<?> collection) {
      return collection.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
    return String.valueOf(value).strip();
  }
}
