package com.flamingo.ai.knowledgedesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the knowledge desk backend. */
@SpringBootApplication
public class KnowledgeDeskApplication {

  public static void main(String[] args) {
    SpringApplication.run(KnowledgeDeskApplication.class, args);
  }
}
