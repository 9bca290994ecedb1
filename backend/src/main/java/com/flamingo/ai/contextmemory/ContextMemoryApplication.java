package com.flamingo.ai.contextmemory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the conversational memory and context retrieval service. */
@SpringBootApplication
public class ContextMemoryApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContextMemoryApplication.class, args);
  }
}
