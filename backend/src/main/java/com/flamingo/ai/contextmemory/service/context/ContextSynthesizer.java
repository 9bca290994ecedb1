package com.flamingo.ai.contextmemory.service.context;

import com.flamingo.ai.contextmemory.agent.ContextSynthesisAgent;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.ImmediateMessage;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.LinkedDocument;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.LongTerm;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.PreferenceSnapshot;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.RelevantMemory;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Writes the synthesized layer of an assembled context. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContextSynthesizer {

  static final int MAX_DIGEST_CHARS = 1200;
  private static final int ITEM_CHARS = 200;

  private final ContextSynthesisAgent contextSynthesisAgent;
  private final MeterRegistry meterRegistry;

  /** LLM briefing; the deterministic {@link #digest} when the model fails or answers blank. */
  @CircuitBreaker(name = "synthesis", fallbackMethod = "synthesizeFallback")
  public String synthesize(
      String currentMessage, List<ImmediateMessage> immediate, LongTerm longTerm) {
    String preferences = renderPreferences(longTerm.userPreferences());
    String briefing =
        contextSynthesisAgent.synthesize(
            nullToEmpty(currentMessage),
            renderImmediate(immediate),
            renderLongTerm(longTerm),
            preferences.isEmpty() ? "(none)" : preferences);
    if (briefing == null || briefing.isBlank()) {
      log.debug("Synthesis agent returned a blank briefing, using digest");
      meterRegistry.counter("context.synthesis.fallback").increment();
      return digest(currentMessage, immediate, longTerm);
    }
    return ContextBudget.cut(briefing.trim(), MAX_DIGEST_CHARS);
  }

  @SuppressWarnings("unused")
  private String synthesizeFallback(
      String currentMessage, List<ImmediateMessage> immediate, LongTerm longTerm, Throwable t) {
    log.warn("Context synthesis failed, using digest: {}", t.getMessage());
    meterRegistry.counter("context.synthesis.fallback").increment();
    return digest(currentMessage, immediate, longTerm);
  }

  /** Deterministic digest of the assembled layers. Same input, same text. */
  public String digest(String currentMessage, List<ImmediateMessage> immediate, LongTerm longTerm) {
    List<String> parts = new ArrayList<>();
    if (currentMessage != null && !currentMessage.isBlank()) {
      parts.add("Current request: " + ContextBudget.cut(currentMessage.trim(), ITEM_CHARS) + ".");
    }
    if (!immediate.isEmpty()) {
      parts.add("Continuing a conversation with " + immediate.size() + " recent messages.");
    }
    if (!longTerm.relevantMemories().isEmpty()) {
      parts.add(
          "Related earlier work: "
              + longTerm.relevantMemories().stream()
                  .map(m -> ContextBudget.cut(m.summary(), ITEM_CHARS))
                  .collect(Collectors.joining("; "))
              + ".");
    }
    if (!longTerm.linkedDocuments().isEmpty()) {
      parts.add(
          "Documents in use: "
              + longTerm.linkedDocuments().stream()
                  .map(LinkedDocument::documentId)
                  .collect(Collectors.joining(", "))
              + ".");
    }
    String preferences = renderPreferences(longTerm.userPreferences());
    if (!preferences.isEmpty()) {
      parts.add("Preferences: " + preferences.replace('\n', ' ') + ".");
    }
    return ContextBudget.cut(String.join(" ", parts), MAX_DIGEST_CHARS);
  }

  private static String renderImmediate(List<ImmediateMessage> immediate) {
    if (immediate.isEmpty()) {
      return "(none)";
    }
    return immediate.stream()
        .map(m -> m.role().name() + ": " + m.content())
        .collect(Collectors.joining("\n"));
  }

  private static String renderLongTerm(LongTerm longTerm) {
    List<String> lines = new ArrayList<>();
    for (RelevantMemory memory : longTerm.relevantMemories()) {
      lines.add("- [conversation " + memory.conversationId() + "] " + memory.summary());
    }
    for (LinkedDocument document : longTerm.linkedDocuments()) {
      lines.add("- [document " + document.documentId() + "] " + nullToEmpty(document.summary()));
    }
    return lines.isEmpty() ? "(none)" : String.join("\n", lines);
  }

  private static String renderPreferences(PreferenceSnapshot preferences) {
    if (preferences == null || preferences.isEmpty()) {
      return "";
    }
    List<String> lines = new ArrayList<>();
    if (preferences.language() != null) {
      lines.add("language=" + preferences.language());
    }
    if (preferences.communicationStyle() != null) {
      lines.add("style=" + preferences.communicationStyle());
    }
    if (preferences.difficultyBias() != null) {
      lines.add("difficulty=" + preferences.difficultyBias());
    }
    preferences.questionTypeBias().entrySet().stream()
        .max(Map.Entry.comparingByValue())
        .ifPresent(top -> lines.add("usually asks " + top.getKey()));
    return String.join("\n", lines);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
