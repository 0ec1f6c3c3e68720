package com.flamingo.ai.legalreport.domain.enums;

/** Significance groups for field changes; declaration order is summary priority. */
public enum ChangeCategory {
  OWNERSHIP("la composición societaria"),
  CAPITAL("el capital"),
  ADMINISTRATION("la administración"),
  CORPORATE_IDENTITY("la identidad de la sociedad"),
  PURPOSE("el objeto social"),
  LEGALIZATION("los antecedentes de legalización"),
  ADDRESS("el domicilio"),
  OTHER("otros antecedentes");

  private final String description;

  ChangeCategory(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
