package com.flamingo.ai.contextmemory.service.writer;

import com.flamingo.ai.contextmemory.agent.TurnSummaryAgent;
import com.flamingo.ai.contextmemory.agent.dto.TurnSummaryResult;
import com.flamingo.ai.contextmemory.config.MemoryConfig;
import com.flamingo.ai.contextmemory.domain.enums.MessageRole;
import com.flamingo.ai.contextmemory.domain.model.RecentMessage;
import com.flamingo.ai.contextmemory.domain.model.TurnSummary;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the summary, key points and decisions of a finished conversation.
 *
 * <p>The default path is deterministic text heuristics. With {@code
 * memory.writer.llm-summary-enabled} the {@link TurnSummaryAgent} is tried first.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TurnSummarizer {

  static final int MAX_KEY_POINTS = 8;
  static final int MAX_DECISIONS = 8;
  private static final int MAX_ITEM_CHARS = 200;
  private static final int TOPIC_CHARS = 240;

  private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+|\\n+");
  private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:[-*\\u2022]|\\d+[.)])\\s+");
  private static final Pattern HAS_DIGIT = Pattern.compile(".*\\d.*");
  private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}{3,}");
  private static final List<String> DECISION_CUES =
      List.of(
          "let's ",
          "lets ",
          "i want",
          "i'd like",
          "i would like",
          "i prefer",
          "i choose",
          "go with",
          "make it",
          "use ",
          "we will",
          "we'll",
          "please create",
          "please make",
          "please generate");

  private final TurnSummaryAgent turnSummaryAgent;
  private final MemoryConfig memoryConfig;
  private final MeterRegistry meterRegistry;

  public TurnSummary summarize(List<RecentMessage> transcript) {
    if (memoryConfig.getWriter().isLlmSummaryEnabled()) {
      try {
        TurnSummaryResult result = turnSummaryAgent.summarize(render(transcript));
        if (result != null && result.summary() != null && !result.summary().isBlank()) {
          return new TurnSummary(
              cap(result.summary().trim(), memoryConfig.getWriter().getMaxSummaryChars()),
              limit(result.keyPoints(), MAX_KEY_POINTS),
              limit(result.decisions(), MAX_DECISIONS));
        }
        log.debug("Turn summary agent returned an empty summary, using heuristics");
      } catch (RuntimeException e) {
        log.warn("Turn summary agent failed, using heuristics: {}", e.getMessage());
        meterRegistry.counter("memory.summary.fallback").increment();
      }
    }
    return heuristicSummary(transcript);
  }

  @VisibleForTesting
  TurnSummary heuristicSummary(List<RecentMessage> transcript) {
    List<RecentMessage> userMessages = byRole(transcript, MessageRole.USER);
    List<RecentMessage> assistantMessages = byRole(transcript, MessageRole.ASSISTANT);

    StringBuilder summary = new StringBuilder();
    if (!userMessages.isEmpty()) {
      String firstRequest = flatten(userMessages.get(0).content());
      summary.append("User asked: ").append(cap(firstRequest, TOPIC_CHARS));
      if (userMessages.size() > 1) {
        summary
            .append(" Latest request: ")
            .append(cap(flatten(userMessages.get(userMessages.size() - 1).content()), TOPIC_CHARS));
      }
    }
    if (!assistantMessages.isEmpty()) {
      String lastReply = assistantMessages.get(assistantMessages.size() - 1).content();
      List<String> sentences = sentences(lastReply);
      if (!sentences.isEmpty()) {
        if (summary.length() > 0) {
          summary.append(' ');
        }
        summary.append("Assistant: ").append(cap(sentences.get(0), TOPIC_CHARS));
      }
    }
    if (summary.length() == 0) {
      summary.append("Empty conversation");
    }

    return new TurnSummary(
        cap(summary.toString(), memoryConfig.getWriter().getMaxSummaryChars()),
        keyPoints(assistantMessages),
        decisions(userMessages));
  }

  private List<String> keyPoints(List<RecentMessage> assistantMessages) {
    Set<String> points = new LinkedHashSet<>();
    for (RecentMessage message : assistantMessages) {
      for (String line : message.content().split("\\n")) {
        if (LIST_MARKER.matcher(line).find()) {
          addItem(points, LIST_MARKER.matcher(line).replaceFirst(""));
          continue;
        }
        for (String sentence : sentences(line)) {
          if (HAS_DIGIT.matcher(sentence).matches() && HAS_LETTER.matcher(sentence).find()) {
            addItem(points, sentence);
          }
        }
      }
    }
    return points.stream().limit(MAX_KEY_POINTS).collect(Collectors.toList());
  }

  private List<String> decisions(List<RecentMessage> userMessages) {
    Set<String> decisions = new LinkedHashSet<>();
    for (RecentMessage message : userMessages) {
      for (String sentence : sentences(message.content())) {
        String lower = sentence.toLowerCase(Locale.ROOT);
        if (DECISION_CUES.stream().anyMatch(lower::contains)) {
          addItem(decisions, sentence);
        }
      }
    }
    return decisions.stream().limit(MAX_DECISIONS).collect(Collectors.toList());
  }

  private static void addItem(Set<String> items, String raw) {
    String item = cap(flatten(raw), MAX_ITEM_CHARS);
    if (!item.isBlank()) {
      items.add(item);
    }
  }

  private static List<RecentMessage> byRole(List<RecentMessage> transcript, MessageRole role) {
    return transcript.stream()
        .filter(m -> m.role() == role && m.content() != null && !m.content().isBlank())
        .collect(Collectors.toList());
  }

  private static List<String> sentences(String text) {
    List<String> result = new ArrayList<>();
    if (text == null) {
      return result;
    }
    for (String part : SENTENCE_BREAK.split(text)) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        result.add(trimmed);
      }
    }
    return result;
  }

  private static List<String> limit(List<String> items, int max) {
    if (items == null) {
      return List.of();
    }
    return items.stream()
        .filter(item -> item != null && !item.isBlank())
        .map(item -> cap(item.trim(), MAX_ITEM_CHARS))
        .distinct()
        .limit(max)
        .collect(Collectors.toList());
  }

  static String render(List<RecentMessage> transcript) {
    return transcript.stream()
        .map(m -> m.role().name() + ": " + m.content())
        .collect(Collectors.joining("\n\n"));
  }

  private static String flatten(String text) {
    return text.replaceAll("\\s+", " ").trim();
  }

  static String cap(String text, int maxLength) {
    if (text.length() <= maxLength) {
      return text;
    }
    return text.substring(0, maxLength) + "...";
  }
}
