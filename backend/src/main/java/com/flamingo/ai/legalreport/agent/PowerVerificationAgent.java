package com.flamingo.ai.legalreport.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent for confirming that a text fragment grants a specific catalogued power.
 *
 * <p>Candidates reach this agent only after passing the anchor pre-filter, so the agent judges
 * meaning rather than searching.
 */
public interface PowerVerificationAgent {

  @SystemMessage(
      """
        Eres un abogado chileno experto en poderes y facultades de administración de sociedades.

        Determina si el fragmento OTORGA la facultad indicada a algún administrador, gerente o
        apoderado. Mencionar la facultad no basta: debe estar conferida.

        Responde SOLO con JSON:
        {
          "otorgado": true|false,
          "actor": "a quién se otorga o null",
          "limites": "montos o condiciones o null",
          "restricciones": "prohibiciones o null",
          "evidencia": "cita textual breve",
          "confianza": 0.0-1.0
        }
        """)
  @UserMessage(
      """
        Facultad: {{code}} - {{name}}
        Descripción: {{description}}

        Fragmento:
        {{fragment}}
        """)
  String verify(
      @V("code") String code,
      @V("name") String name,
      @V("description") String description,
      @V("fragment") String fragment);
}
