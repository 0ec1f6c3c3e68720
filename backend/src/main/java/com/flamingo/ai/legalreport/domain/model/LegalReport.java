package com.flamingo.ai.legalreport.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.flamingo.ai.legalreport.domain.enums.ReportSection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** The consolidated seven-section report. Section and field order is fixed. */
public record LegalReport(Map<ReportSection, Map<String, ResolvedValue>> sections) {

  public LegalReport {
    EnumMap<ReportSection, Map<String, ResolvedValue>> copy = new EnumMap<>(ReportSection.class);
    for (ReportSection section : ReportSection.values()) {
      Map<String, ResolvedValue> fields = sections.getOrDefault(section, Map.of());
      copy.put(section, Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }
    sections = Collections.unmodifiableMap(copy);
  }

  public Map<String, ResolvedValue> section(ReportSection section) {
    return sections.get(section);
  }

  public ResolvedValue value(ReportSection section, String field) {
    return sections.get(section).getOrDefault(field, ResolvedValue.missing());
  }

  @JsonValue
  public Map<String, Map<String, ResolvedValue>> toJson() {
    Map<String, Map<String, ResolvedValue>> json = new LinkedHashMap<>();
    sections.forEach((section, fields) -> json.put(section.key(), fields));
    return json;
  }
}
