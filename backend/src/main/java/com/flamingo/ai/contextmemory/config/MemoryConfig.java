package com.flamingo.ai.contextmemory.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the memory engine. */
@Configuration
@ConfigurationProperties(prefix = "memory")
@Getter
@Setter
public class MemoryConfig {

  /** Global switch for memory retrieval and persistence. */
  private boolean enabled = true;

  private Embedding embedding = new Embedding();
  private Search search = new Search();
  private Scoring scoring = new Scoring();
  private Context context = new Context();
  private Writer writer = new Writer();
  private Sweep sweep = new Sweep();
  private SessionState session = new SessionState();

  @PostConstruct
  void validate() {
    scoring.validate();
    if (embedding.getDimensions() <= 0) {
      throw new IllegalStateException("memory.embedding.dimensions must be positive");
    }
    if (search.getMinSimilarity() < -1.0 || search.getMinSimilarity() > 1.0) {
      throw new IllegalStateException("memory.search.min-similarity must be within [-1, 1]");
    }
  }

  @Getter
  @Setter
  public static class Embedding {
    private int dimensions = 1536;
    private Duration timeout = Duration.ofSeconds(3);

    /** Inputs longer than this are cut before being sent to the provider. */
    private int maxInputChars = 5000;
  }

  @Getter
  @Setter
  public static class Search {
    private int defaultLimit = 10;

    /**
     * Minimum cosine similarity for a record to be returned. Tunable: the value that works for
     * one embedding model is not necessarily right for another.
     */
    private double minSimilarity = 0.7;

    private int defaultDepthDays = 30;

    /** Vector index backend: "store" (exact scan over the relational store) or "elasticsearch". */
    private String backend = "store";

    /** Over-fetch factor applied when the index is approximate. */
    private int candidateMultiplier = 3;
  }

  @Getter
  @Setter
  public static class Scoring {
    private double messageWeight = 0.35;
    private double documentWeight = 0.2;
    private double artifactWeight = 0.15;
    private double keyPointWeight = 0.3;

    /** Message count at which the message term saturates. */
    private int messageSaturation = 20;

    /** Key point count at which the key point term saturates. */
    private int keyPointSaturation = 8;

    void validate() {
      double[] weights = {messageWeight, documentWeight, artifactWeight, keyPointWeight};
      double sum = 0.0;
      for (double w : weights) {
        if (w < 0.0) {
          throw new IllegalStateException("memory.scoring weights must be non-negative");
        }
        sum += w;
      }
      if (sum > 1.0 + 1e-9) {
        throw new IllegalStateException(
            "memory.scoring weights must sum to at most 1.0 but sum to " + sum);
      }
      if (messageSaturation <= 0 || keyPointSaturation <= 0) {
        throw new IllegalStateException("memory.scoring saturation points must be positive");
      }
    }
  }

  @Getter
  @Setter
  public static class Context {
    /** Number of recent user/assistant exchanges kept verbatim. */
    private int immediateExchanges = 3;

    private int maxMessageChars = 3000;

    /** Token budget for the immediate and long-term layers combined. */
    private int tokenBudget = 4000;

    /** Absolute size ceiling for the immediate layer. */
    private int immediateHardCeilingChars = 60000;

    /** Upper bound for the whole read path, synthesis included. */
    private Duration timeout = Duration.ofSeconds(5);

    private boolean synthesisEnabled = true;

    public int immediateMessageCount() {
      return immediateExchanges * 2;
    }
  }

  @Getter
  @Setter
  public static class Writer {
    /** Ask the chat model for the turn summary; text heuristics are used when off or failing. */
    private boolean llmSummaryEnabled = false;

    /** Longest summary kept on a memory. */
    private int maxSummaryChars = 1200;
  }

  @Getter
  @Setter
  public static class Sweep {
    private boolean enabled = true;
    private Duration interval = Duration.ofMinutes(5);
    private int batchSize = 50;
  }

  @Getter
  @Setter
  public static class SessionState {
    private Duration defaultTtl = Duration.ofHours(2);
  }
}
