package com.flamingo.ai.photostore.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the photo metadata store. */
@Configuration
@ConfigurationProperties(prefix = "photo-store")
@Getter
@Setter
public class PhotoStoreConfig {

  private Ingestion ingestion = new Ingestion();
  private Face face = new Face();
  private Query query = new Query();

  @Getter
  @Setter
  public static class Ingestion {
    /** Detections below this confidence are dropped before they are stored. */
    private double minConfidence = 0.0;
  }

  @Getter
  @Setter
  public static class Face {
    /** Length every stored face encoding must have (128 for dlib-style embeddings). */
    private int encodingLength = 128;
  }

  @Getter
  @Setter
  public static class Query {
    /** Number of classes reported in the statistics ranking. */
    private int topClassesLimit = 10;

    private int defaultPageSize = 20;
    private int maxPageSize = 200;
  }
}
