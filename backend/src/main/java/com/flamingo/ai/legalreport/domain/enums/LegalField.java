package com.flamingo.ai.legalreport.domain.enums;

import static com.flamingo.ai.legalreport.domain.enums.ChangeCategory.ADDRESS;
import static com.flamingo.ai.legalreport.domain.enums.ChangeCategory.ADMINISTRATION;
import static com.flamingo.ai.legalreport.domain.enums.ChangeCategory.CAPITAL;
import static com.flamingo.ai.legalreport.domain.enums.ChangeCategory.CORPORATE_IDENTITY;
import static com.flamingo.ai.legalreport.domain.enums.ChangeCategory.LEGALIZATION;
import static com.flamingo.ai.legalreport.domain.enums.ChangeCategory.OTHER;
import static com.flamingo.ai.legalreport.domain.enums.ChangeCategory.OWNERSHIP;
import static com.flamingo.ai.legalreport.domain.enums.ChangeCategory.PURPOSE;
import static com.flamingo.ai.legalreport.domain.enums.FieldResolution.BASE_ONLY;
import static com.flamingo.ai.legalreport.domain.enums.FieldResolution.CUMULATIVE;
import static com.flamingo.ai.legalreport.domain.enums.FieldResolution.EARLIEST;
import static com.flamingo.ai.legalreport.domain.enums.FieldResolution.LATEST;
import static com.flamingo.ai.legalreport.domain.enums.ReportSection.ADMINISTRACION;
import static com.flamingo.ai.legalreport.domain.enums.ReportSection.CAPITAL_SOCIAL;
import static com.flamingo.ai.legalreport.domain.enums.ReportSection.CONSTITUCION;
import static com.flamingo.ai.legalreport.domain.enums.ReportSection.ENCABEZADO;
import static com.flamingo.ai.legalreport.domain.enums.ReportSection.LEGALIZACION;
import static com.flamingo.ai.legalreport.domain.enums.ReportSection.PODERES_PERSONARIAS;
import static com.flamingo.ai.legalreport.domain.enums.ReportSection.RESTRICCIONES;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The report schema. Each constant is one report field: where it lives, how conflicting values are
 * resolved, how a change to it is described, and what the extraction model is asked for.
 *
 * <p>Declaration order is the report order and the order in which field changes are listed.
 */
public enum LegalField {
  RAZON_SOCIAL(
      "razon_social", ENCABEZADO, LATEST, true, CORPORATE_IDENTITY, ValueKind.TEXT,
      "Cambio de razón social", "Razón social vigente de la sociedad"),
  RUT(
      "rut", ENCABEZADO, LATEST, true, CORPORATE_IDENTITY, ValueKind.TEXT,
      "Cambio de RUT", "RUT de la sociedad, formato 76.123.456-7"),
  NOMBRE_FANTASIA(
      "nombre_fantasia", ENCABEZADO, LATEST, false, CORPORATE_IDENTITY, ValueKind.TEXT,
      "Cambio de nombre de fantasía", "Nombre de fantasía, si existe"),

  RAZON_SOCIAL_ANTERIOR(
      "razon_social_anterior", CONSTITUCION, LATEST, false, CORPORATE_IDENTITY, ValueKind.TEXT,
      "Cambio de razón social anterior", "Razón social previa, si el documento la menciona"),
  TIPO_SOCIEDAD(
      "tipo_sociedad", CONSTITUCION, LATEST, true, CORPORATE_IDENTITY, ValueKind.TEXT,
      "Transformación del tipo de sociedad", "Tipo de sociedad (SpA, Ltda., S.A., EIRL, etc.)"),
  DOMICILIO(
      "domicilio", CONSTITUCION, LATEST, true, ADDRESS, ValueKind.TEXT,
      "Cambio de domicilio", "Domicilio social"),
  OBJETO_SOCIAL(
      "objeto_social", CONSTITUCION, LATEST, false, PURPOSE, ValueKind.TEXT,
      "Modificación del objeto social", "Resumen breve del objeto social"),
  FECHA_CONSTITUCION(
      "fecha_constitucion", CONSTITUCION, EARLIEST, false, OTHER, ValueKind.TEXT,
      "Cambio de fecha de constitución", "Fecha de constitución, formato YYYY-MM-DD"),
  FECHA_TERMINO(
      "fecha_termino", CONSTITUCION, LATEST, false, OTHER, ValueKind.TEXT,
      "Modificación de la duración de la sociedad", "Fecha o plazo de término de la sociedad"),
  FRECUENCIA_PRORROGA(
      "frecuencia_prorroga", CONSTITUCION, LATEST, false, OTHER, ValueKind.TEXT,
      "Modificación de la prórroga", "Regla de prórroga automática de la duración"),
  EN_CASO_DE_FALLECIMIENTO(
      "en_caso_de_fallecimiento", CONSTITUCION, LATEST, false, OWNERSHIP, ValueKind.TEXT,
      "Modificación de la cláusula de fallecimiento", "Qué ocurre si fallece un socio"),

  CAPITAL_SUSCRITO(
      "capital_suscrito", CAPITAL_SOCIAL, LATEST, true, CAPITAL, ValueKind.MONEY,
      "Modificación de capital suscrito", "Capital suscrito con su moneda, p. ej. $ 1.000.000"),
  CAPITAL_PAGADO(
      "capital_pagado", CAPITAL_SOCIAL, LATEST, false, CAPITAL, ValueKind.MONEY,
      "Modificación de capital pagado", "Capital efectivamente pagado con su moneda"),
  PLAZO_PARA_ENTERARLO(
      "plazo_para_enterarlo", CAPITAL_SOCIAL, LATEST, false, CAPITAL, ValueKind.TEXT,
      "Modificación del plazo para enterar el capital", "Plazo para enterar el capital"),
  NUMERO_ACCIONES(
      "numero_acciones", CAPITAL_SOCIAL, LATEST, false, CAPITAL, ValueKind.TEXT,
      "Modificación del número de acciones", "Número de acciones, si aplica"),
  SOCIOS(
      "socios", CAPITAL_SOCIAL, LATEST, false, OWNERSHIP, ValueKind.LIST,
      "Cambio en la composición de socios", "Lista de socios o accionistas con su participación"),
  RESPONSABILIDAD_SOCIOS(
      "responsabilidad_socios", CAPITAL_SOCIAL, LATEST, false, OWNERSHIP, ValueKind.TEXT,
      "Modificación de la responsabilidad de los socios", "Responsabilidad de los socios"),
  DISTRIBUCION_UTILIDADES(
      "distribucion_utilidades", CAPITAL_SOCIAL, LATEST, false, OWNERSHIP, ValueKind.TEXT,
      "Modificación de la distribución de utilidades", "Regla de distribución de utilidades"),
  CIERRE_EJERCICIO(
      "cierre_ejercicio", CAPITAL_SOCIAL, LATEST, false, OTHER, ValueKind.TEXT,
      "Cambio de cierre de ejercicio", "Fecha de cierre del ejercicio"),

  TIPO_ADMINISTRACION(
      "tipo_administracion", ADMINISTRACION, LATEST, true, ADMINISTRATION, ValueKind.TEXT,
      "Cambio en el tipo de administración", "Tipo de administración (directorio, socios, etc.)"),
  ADMINISTRADORES(
      "administradores", ADMINISTRACION, LATEST, false, ADMINISTRATION, ValueKind.LIST,
      "Cambio de administradores", "Nombres de los administradores titulares"),
  REPRESENTANTES_LEGALES(
      "representantes_legales", ADMINISTRACION, LATEST, false, ADMINISTRATION, ValueKind.LIST,
      "Cambio de representantes legales", "Nombres de los representantes legales"),
  FIRMAS_REQUERIDAS(
      "firmas_requeridas", ADMINISTRACION, LATEST, false, ADMINISTRATION, ValueKind.TEXT,
      "Modificación de las firmas requeridas", "Número de firmas requeridas para obligar"),
  DURACION_ADMINISTRACION(
      "duracion_administracion", ADMINISTRACION, LATEST, false, ADMINISTRATION, ValueKind.TEXT,
      "Modificación de la duración de la administración",
      "Duración del cargo de administrador"),
  FORMA_DE_ACTUAR(
      "forma_de_actuar", ADMINISTRACION, LATEST, false, ADMINISTRATION, ValueKind.TEXT,
      "Modificación de la forma de actuar", "Forma de actuar (conjunta, separada, indistinta)"),

  CODIGO_ESCRITURA(
      "codigo_escritura", LEGALIZACION, BASE_ONLY, false, LEGALIZATION, ValueKind.TEXT,
      "Cambio de código de escritura", "Código o número de la escritura"),
  TIPO_ESCRITURA(
      "tipo_escritura", LEGALIZACION, BASE_ONLY, false, LEGALIZATION, ValueKind.TEXT,
      "Cambio de tipo de escritura", "Tipo de escritura (constitución, modificación, etc.)"),
  REPERTORIO(
      "repertorio", LEGALIZACION, BASE_ONLY, true, LEGALIZATION, ValueKind.TEXT,
      "Nuevo número de repertorio", "Número de repertorio"),
  NOTARIA(
      "notaria", LEGALIZACION, BASE_ONLY, true, LEGALIZATION, ValueKind.TEXT,
      "Cambio de notaría", "Notaría y notario ante quien se otorgó"),
  CIUDAD_NOTARIA(
      "ciudad_notaria", LEGALIZACION, BASE_ONLY, false, LEGALIZATION, ValueKind.TEXT,
      "Cambio de ciudad de la notaría", "Ciudad de la notaría"),
  FECHA_NOTARIA(
      "fecha_notaria", LEGALIZACION, BASE_ONLY, false, LEGALIZATION, ValueKind.TEXT,
      "Cambio de fecha de escritura", "Fecha de otorgamiento, formato YYYY-MM-DD"),
  FECHA_PUBLICACION_DIARIO_OFICIAL(
      "fecha_publicacion_diario_oficial", LEGALIZACION, BASE_ONLY, false, LEGALIZATION,
      ValueKind.TEXT, "Cambio de fecha de publicación",
      "Fecha de publicación en el Diario Oficial"),
  INSCRIPCION_REGISTRO_COMERCIO(
      "inscripcion_registro_comercio", LEGALIZACION, BASE_ONLY, false, LEGALIZATION,
      ValueKind.TEXT, "Cambio de inscripción", "Fojas, número y año de la inscripción"),
  OBSERVACION_INSCRIPCION(
      "observacion_inscripcion", LEGALIZACION, BASE_ONLY, false, LEGALIZATION, ValueKind.TEXT,
      "Cambio de observación de inscripción", "Observaciones o notas marginales"),
  VIGENCIA_DESDE(
      "vigencia_desde", LEGALIZACION, BASE_ONLY, false, LEGALIZATION, ValueKind.TEXT,
      "Cambio de inicio de vigencia", "Inicio de vigencia, formato YYYY-MM-DD"),
  VIGENCIA_HASTA(
      "vigencia_hasta", LEGALIZACION, BASE_ONLY, false, LEGALIZATION, ValueKind.TEXT,
      "Cambio de término de vigencia", "Término de vigencia, formato YYYY-MM-DD"),

  FACULTADES_ENCONTRADAS(
      "facultades_encontradas", PODERES_PERSONARIAS, CUMULATIVE, false, ADMINISTRATION,
      ValueKind.LIST, "Modificación de facultades", null),

  RESTRICCIONES_LIST(
      "restricciones", RESTRICCIONES, CUMULATIVE, false, ADMINISTRATION, ValueKind.LIST,
      "Modificación de restricciones", "Restricciones o limitaciones a la administración");

  private final String key;
  private final ReportSection section;
  private final FieldResolution resolution;
  private final boolean required;
  private final ChangeCategory category;
  private final ValueKind kind;
  private final String changeLabel;
  private final String extractionHint;

  LegalField(
      String key,
      ReportSection section,
      FieldResolution resolution,
      boolean required,
      ChangeCategory category,
      ValueKind kind,
      String changeLabel,
      String extractionHint) {
    this.key = key;
    this.section = section;
    this.resolution = resolution;
    this.required = required;
    this.category = category;
    this.kind = kind;
    this.changeLabel = changeLabel;
    this.extractionHint = extractionHint;
  }

  public String key() {
    return key;
  }

  public ReportSection section() {
    return section;
  }

  public FieldResolution resolution() {
    return resolution;
  }

  public boolean required() {
    return required;
  }

  public ChangeCategory category() {
    return category;
  }

  public ValueKind kind() {
    return kind;
  }

  public String changeLabel() {
    return changeLabel;
  }

  public String extractionHint() {
    return extractionHint;
  }

  /** Whether the field is read from a document's structured extraction output. */
  public boolean extracted() {
    return extractionHint != null;
  }

  public static Optional<LegalField> fromKey(String key) {
    return Arrays.stream(values()).filter(f -> f.key.equals(key)).findFirst();
  }

  public static List<LegalField> inSection(ReportSection section) {
    return Arrays.stream(values()).filter(f -> f.section == section).toList();
  }

  public static List<LegalField> extractable() {
    return Arrays.stream(values()).filter(LegalField::extracted).toList();
  }
}
