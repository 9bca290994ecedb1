package com.flamingo.ai.contextmemory.agent;

import com.flamingo.ai.contextmemory.agent.dto.TurnSummaryResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Summarizes a finished conversation so it can be remembered. The writer falls back to text
 * heuristics when this agent is disabled or fails.
 */
public interface TurnSummaryAgent {

  @SystemMessage(
      """
        You summarize tutoring conversations for long-term memory.

        Rules:
        - summary: 1-3 sentences naming the topic and what was achieved
        - keyPoints: up to 8 short facts worth recalling later
        - decisions: choices the user made (formats, counts, difficulty), empty if none
        - Use the language of the conversation
        - Return ONLY valid JSON
        """)
  @UserMessage(
      """
        Conversation:
        {{transcript}}

        Return JSON: {"summary": "...", "keyPoints": ["..."], "decisions": ["..."]}
        """)
  TurnSummaryResult summarize(@V("transcript") String transcript);
}
