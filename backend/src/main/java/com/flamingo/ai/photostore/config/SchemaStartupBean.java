package com.flamingo.ai.photostore.config;

import com.flamingo.ai.photostore.schema.SchemaManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Startup bean that makes sure the database schema exists before the store accepts work.
 *
 * <p>A {@link com.flamingo.ai.photostore.exception.SchemaException} propagates and aborts
 * application startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SchemaStartupBean implements CommandLineRunner {

  private final SchemaManager schemaManager;

  @Override
  public void run(String... args) {
    log.info("Verifying photo store schema...");
    schemaManager.ensureSchema();
    log.info("Photo store schema ready");
  }
}
