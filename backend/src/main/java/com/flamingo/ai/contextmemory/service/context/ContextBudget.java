package com.flamingo.ai.contextmemory.service.context;

import com.flamingo.ai.contextmemory.config.MemoryConfig;
import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.ImmediateMessage;
import com.flamingo.ai.contextmemory.domain.model.RecentMessage;
import com.flamingo.ai.contextmemory.domain.model.ScoredMemory;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Size policy of an assembled context.
 *
 * <p>Tokens are estimated as characters / 4. The immediate layer keeps the last K exchanges, each
 * message cut to the per-message ceiling, and is only shortened further by the absolute ceiling.
 * The long-term layer gives way first: lowest-ranked memories, then attached documents from the
 * last one backwards.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContextBudget {

  static final int CHARS_PER_TOKEN = 4;
  private static final String CUT_MARKER = "...";

  private final MemoryConfig memoryConfig;

  /** The long-term entries that fit next to the immediate layer. */
  public record LongTermSelection(
      List<ScoredMemory<ConversationMemory>> memories, List<DocumentMemory> documents) {}

  public List<ImmediateMessage> immediate(List<RecentMessage> recentMessages) {
    MemoryConfig.Context context = memoryConfig.getContext();
    int keep = context.immediateMessageCount();
    int from = Math.max(0, recentMessages.size() - keep);

    List<ImmediateMessage> messages = new ArrayList<>();
    for (RecentMessage message : recentMessages.subList(from, recentMessages.size())) {
      String content = message.content() == null ? "" : message.content();
      String kept = cut(content, context.getMaxMessageChars());
      messages.add(new ImmediateMessage(message.role(), kept));
    }

    int ceiling = context.getImmediateHardCeilingChars();
    int total = messages.stream().mapToInt(m -> m.content().length()).sum();
    while (total > ceiling && messages.size() > 1) {
      total -= messages.remove(0).content().length();
    }
    if (total > ceiling) {
      ImmediateMessage last = messages.get(0);
      messages.set(0, new ImmediateMessage(last.role(), cut(last.content(), ceiling)));
      log.warn("Immediate layer hit the absolute ceiling of {} chars", ceiling);
    }
    return messages;
  }

  /**
   * Drops long-term entries until the whole context fits the token budget.
   *
   * @param memories ranked best first
   * @param documents in attachment order
   */
  public LongTermSelection fit(
      List<ImmediateMessage> immediate,
      List<ScoredMemory<ConversationMemory>> memories,
      List<DocumentMemory> documents) {
    int budget = memoryConfig.getContext().getTokenBudget();
    List<ScoredMemory<ConversationMemory>> keptMemories = new ArrayList<>(memories);
    List<DocumentMemory> keptDocuments = new ArrayList<>(documents);

    int used =
        immediate.stream().mapToInt(ContextBudget::estimateTokens).sum()
            + keptMemories.stream().mapToInt(m -> estimateTokens(m.record().getSummary())).sum()
            + keptDocuments.stream().mapToInt(d -> estimateTokens(d.getSummary())).sum();

    while (used > budget && !keptMemories.isEmpty()) {
      used -= estimateTokens(keptMemories.remove(keptMemories.size() - 1).record().getSummary());
    }
    while (used > budget && !keptDocuments.isEmpty()) {
      used -= estimateTokens(keptDocuments.remove(keptDocuments.size() - 1).getSummary());
    }
    int dropped =
        memories.size() - keptMemories.size() + documents.size() - keptDocuments.size();
    if (dropped > 0) {
      log.debug("Dropped {} long-term entries to fit {} tokens", dropped, budget);
    }
    return new LongTermSelection(keptMemories, keptDocuments);
  }

  static int estimateTokens(ImmediateMessage message) {
    return estimateTokens(message.role().name()) + estimateTokens(message.content());
  }

  static int estimateTokens(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
  }

  static String cut(String text, int maxChars) {
    if (text.length() <= maxChars) {
      return text;
    }
    if (maxChars <= CUT_MARKER.length()) {
      return text.substring(0, maxChars);
    }
    return text.substring(0, maxChars - CUT_MARKER.length()) + CUT_MARKER;
  }
}
