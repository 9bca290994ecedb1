package com.flamingo.ai.contextmemory.domain.model;

import com.flamingo.ai.contextmemory.domain.enums.MessageRole;
import java.time.LocalDateTime;

/** One raw message of the active conversation, as handed over by the chat layer. */
public record RecentMessage(MessageRole role, String content, LocalDateTime timestamp) {}
