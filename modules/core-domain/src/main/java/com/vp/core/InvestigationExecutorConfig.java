package com.vp.core;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class InvestigationExecutorConfig {

  /** Pool for concurrent steps; only used when app.parallel-fanout=true. */
  @Bean(destroyMethod = "shutdown")
  public ExecutorService investigationExecutor() {
    CustomizableThreadFactory threads = new CustomizableThreadFactory("investigation-");
    threads.setDaemon(true);
    return Executors.newFixedThreadPool(6, threads);
  }
}
