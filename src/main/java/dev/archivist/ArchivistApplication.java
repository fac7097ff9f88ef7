package dev.archivist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Archivist ingestion application.
 *
 * <p>Runs as a non-web batch process: {@link dev.archivist.runner.IngestionRunner} loads the Q&amp;A
 * dataset, embeds every chunk, and commits it to pgvector before the context shuts down.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ArchivistApplication {
  public static void main(String[] args) {
    SpringApplication.run(ArchivistApplication.class, args);
  }
}
