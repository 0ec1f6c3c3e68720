package com.flamingo.ai.legalreport.config;

import com.flamingo.ai.legalreport.agent.DocumentClassificationAgent;
import com.flamingo.ai.legalreport.agent.PowerVerificationAgent;
import com.flamingo.ai.legalreport.agent.PrimaryDateAgent;
import com.flamingo.ai.legalreport.agent.StructuredExtractionAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Configuration for the extraction agents using LangChain4j AI Services.
 *
 * <p>Every agent returns the raw JSON string so that callers control parsing and can report
 * malformed output as a retryable failure.
 */
@Configuration
public class AiAgentConfig {

  @Bean
  @Lazy
  public StructuredExtractionAgent structuredExtractionAgent(@Lazy ChatModel chatModel) {
    return AiServices.builder(StructuredExtractionAgent.class).chatModel(chatModel).build();
  }

  @Bean
  @Lazy
  public DocumentClassificationAgent documentClassificationAgent(@Lazy ChatModel chatModel) {
    return AiServices.builder(DocumentClassificationAgent.class).chatModel(chatModel).build();
  }

  @Bean
  @Lazy
  public PrimaryDateAgent primaryDateAgent(@Lazy ChatModel chatModel) {
    return AiServices.builder(PrimaryDateAgent.class).chatModel(chatModel).build();
  }

  /** Verifies that a candidate fragment actually grants a catalogued power. */
  @Bean
  @Lazy
  public PowerVerificationAgent powerVerificationAgent(@Lazy ChatModel chatModel) {
    return AiServices.builder(PowerVerificationAgent.class).chatModel(chatModel).build();
  }
}
