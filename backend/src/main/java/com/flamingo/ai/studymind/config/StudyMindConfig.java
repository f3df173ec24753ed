package com.flamingo.ai.studymind.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the chat orchestration pipeline. */
@Configuration
@ConfigurationProperties(prefix = "studymind")
@Getter
@Setter
public class StudyMindConfig {

  private Summary summary = new Summary();
  private Conversation conversation = new Conversation();
  private References references = new References();
  private Planning planning = new Planning();
  private Flashcards flashcards = new Flashcards();
  private Rendering rendering = new Rendering();
  private Storage storage = new Storage();

  @Getter
  @Setter
  public static class Summary {
    /** Number of trailing turns fed to the summarizer. */
    private int windowSize = 10;

    private int maxTurnChars = 2000;
  }

  @Getter
  @Setter
  public static class Conversation {
    /** Number of trailing turns replayed to the model in plain conversation. */
    private int historyWindow = 10;
  }

  @Getter
  @Setter
  public static class References {
    private int searchTopK = 5;
    private int maxContentChars = 8000;
  }

  @Getter
  @Setter
  public static class Planning {
    private int maxItems = 10;
  }

  @Getter
  @Setter
  public static class Flashcards {
    private int minCards = 5;
    private int maxCards = 10;
  }

  @Getter
  @Setter
  public static class Rendering {
    private String speechUrlTemplate =
        "https://text.pollinations.ai/{prompt}?model=openai-audio&voice={voice}";
    private String voice = "nova";
    private String imageUrlTemplate =
        "https://image.pollinations.ai/prompt/{prompt}?width={width}&height={height}&nologo=true";
    private String defaultResolution = "1024x1024";
    private int readTimeoutMs = 90000;
    private int maxResponseBytes = 20 * 1024 * 1024;
  }

  @Getter
  @Setter
  public static class Storage {
    private String basePath = "./data/storage";
    private String publicBaseUrl = "http://localhost:8080/files";
    private long maxFileSizeBytes = 50L * 1024 * 1024;
  }
}
