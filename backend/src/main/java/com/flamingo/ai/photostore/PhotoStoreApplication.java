package com.flamingo.ai.photostore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the photo metadata store service. */
@SpringBootApplication
public class PhotoStoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(PhotoStoreApplication.class, args);
  }
}
