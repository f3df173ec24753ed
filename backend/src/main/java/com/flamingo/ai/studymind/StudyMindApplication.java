package com.flamingo.ai.studymind;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the StudyMind backend. */
@SpringBootApplication
public class StudyMindApplication {

  public static void main(String[] args) {
    SpringApplication.run(StudyMindApplication.class, args);
  }
}
