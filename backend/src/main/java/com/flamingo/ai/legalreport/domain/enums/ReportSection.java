package com.flamingo.ai.legalreport.domain.enums;

/** The seven fixed sections of the consolidated legal report, in output order. */
public enum ReportSection {
  ENCABEZADO("encabezado"),
  CONSTITUCION("constitucion"),
  CAPITAL_SOCIAL("capital_social"),
  ADMINISTRACION("administracion"),
  LEGALIZACION("legalizacion"),
  PODERES_PERSONARIAS("poderes_personarias"),
  RESTRICCIONES("restricciones");

  private final String key;

  ReportSection(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }
}
