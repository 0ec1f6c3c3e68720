package com.flamingo.ai.legalreport.config;

import java.util.concurrent.Executor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Thread pools for company runs and for time-limited external calls. */
@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

  private final LegalPipelineConfig config;

  /** Runs several companies side by side; each company run stays on one thread. */
  @Bean(name = "companyRunExecutor")
  public ThreadPoolTaskExecutor companyRunExecutor() {
    int concurrency = Math.max(1, config.getExecution().getMaxConcurrentCompanies());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrency);
    executor.setMaxPoolSize(concurrency);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("company-run-");
    executor.initialize();
    return executor;
  }

  /** Hosts OCR, LLM, embedding and vector store calls so they can be cancelled on timeout. */
  @Bean(name = "externalCallPool")
  public Executor externalCallPool() {
    int threads = Math.max(1, config.getExecution().getExternalCallThreads());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads * 2);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("external-call-");
    executor.initialize();
    return executor;
  }
}
