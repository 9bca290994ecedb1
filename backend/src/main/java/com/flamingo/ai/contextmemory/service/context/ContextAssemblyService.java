package com.flamingo.ai.contextmemory.service.context;

import com.flamingo.ai.contextmemory.domain.model.AssembledContext;
import com.flamingo.ai.contextmemory.domain.model.ContextQuery;

/** Builds the bounded prompt context for one user turn. */
public interface ContextAssemblyService {

  /**
   * Assembles the immediate, long-term and synthesized layers for a turn.
   *
   * <p>Never fails because a long-term source is slow or down: the result then carries only what
   * was available and {@link AssembledContext#longTermDegraded()} is set.
   *
   * @param query the turn to build context for
   * @return the assembled context, never null
   */
  AssembledContext assemble(ContextQuery query);
}
