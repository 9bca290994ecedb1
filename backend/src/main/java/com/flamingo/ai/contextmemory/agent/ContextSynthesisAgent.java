package com.flamingo.ai.contextmemory.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Writes the short digest that sits on top of an assembled turn context. */
public interface ContextSynthesisAgent {

  @SystemMessage(
      """
        You condense the memory of a tutoring assistant into a briefing for its next reply.

        Rules:
        - At most 5 sentences, plain text, no lists or headings
        - Lead with what the user is working on right now
        - Mention earlier conversations or documents only when they bear on the current request
        - Respect stated preferences (language, style, difficulty) if any are given
        - Never invent facts that are not in the material
        """)
  @UserMessage(
      """
        Current request:
        {{currentMessage}}

        Recent conversation:
        {{immediate}}

        Related memories and documents:
        {{longTerm}}

        User preferences:
        {{preferences}}

        Write the briefing.
        """)
  String synthesize(
      @V("currentMessage") String currentMessage,
      @V("immediate") String immediate,
      @V("longTerm") String longTerm,
      @V("preferences") String preferences);
}
