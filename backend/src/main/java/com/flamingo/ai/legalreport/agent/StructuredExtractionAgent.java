package com.flamingo.ai.legalreport.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent for extracting structured legal facts from OCR text.
 *
 * <p>The caller passes the field catalogue as a JSON description; the agent answers with a single
 * JSON object using exactly those keys.
 */
public interface StructuredExtractionAgent {

  @SystemMessage(
      """
        Eres un abogado corporativo chileno que analiza escrituras públicas, inscripciones en el
        Registro de Comercio del Conservador de Bienes Raíces y publicaciones en el Diario Oficial.

        Extrae únicamente información que aparezca literalmente en el documento.

        Reglas:
        - Responde SOLO con un objeto JSON válido, sin texto adicional.
        - Usa exactamente las claves indicadas en el esquema.
        - Si un dato no aparece, usa null.
        - Las fechas deben ir en formato YYYY-MM-DD.
        - Los montos deben conservar su moneda (por ejemplo "$ 1.000.000" o "UF 500").
        - Los campos de tipo lista deben ser arreglos JSON de strings.
        """)
  @UserMessage(
      """
        Esquema ({{schemaName}}):
        {{schema}}

        Documento:
        {{text}}
        """)
  String extract(
      @V("schemaName") String schemaName, @V("schema") String schema, @V("text") String text);
}
