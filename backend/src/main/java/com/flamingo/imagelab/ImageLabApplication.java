package com.flamingo.imagelab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the image processing service. */
@SpringBootApplication
public class ImageLabApplication {

  public static void main(String[] args) {
    SpringApplication.run(ImageLabApplication.class, args);
  }
}
