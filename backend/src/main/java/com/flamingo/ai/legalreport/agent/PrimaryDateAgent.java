package com.flamingo.ai.legalreport.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent for choosing the date on which a legal document was executed. */
public interface PrimaryDateAgent {

  @SystemMessage(
      """
        Recibes un documento legal chileno y la lista de fechas encontradas en él.

        Elige la fecha principal del documento: la fecha de otorgamiento de la escritura, la fecha
        de la inscripción o la fecha de publicación, según corresponda. No elijas fechas de
        documentos anteriores citados en el texto.

        Responde SOLO con JSON: {"fecha_principal": "YYYY-MM-DD"} o {"fecha_principal": null}
        """)
  @UserMessage(
      """
        Fechas candidatas: {{dates}}

        Texto:
        {{text}}
        """)
  String choosePrimaryDate(@V("dates") String dates, @V("text") String text);
}
