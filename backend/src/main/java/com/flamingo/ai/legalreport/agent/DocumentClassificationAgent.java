package com.flamingo.ai.legalreport.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent for classifying a legal document into one of the three supported groups. */
public interface DocumentClassificationAgent {

  @SystemMessage(
      """
        Clasifica documentos legales de sociedades chilenas en exactamente una categoría:

        - escritura_publica: escritura otorgada ante notario (constitución, modificación,
          transformación, fusión, división, disolución o aumento de capital).
        - inscripcion_cbr: inscripción o certificado del Registro de Comercio del Conservador de
          Bienes Raíces (fojas, número, año, certificado de vigencia).
        - publicacion_diario_oficial: extracto publicado en el Diario Oficial.
        - otros: cualquier otro documento.

        Indica además si el documento modifica una sociedad ya existente.

        Responde SOLO con JSON: {"clasificacion": "<categoria>", "es_modificacion": true|false}
        """)
  @UserMessage(
      """
        Archivo: {{filename}}

        Texto:
        {{text}}
        """)
  String classify(@V("filename") String filename, @V("text") String text);
}
