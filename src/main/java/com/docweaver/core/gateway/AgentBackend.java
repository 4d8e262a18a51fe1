package com.docweaver.core.gateway;

import java.util.concurrent.CompletableFuture;

/**
 * A concrete collaborator answering one {@link AgentRole}.
 *
 * <p>Implementations must not block the calling thread; the returned future completes
 * when the collaborator answers. Failures may be reported with any exception type,
 * {@link AgentErrorClassifier} maps them onto the retryable/non-retryable split.
 */
@FunctionalInterface
public interface AgentBackend {

    CompletableFuture<AgentResponse> call(AgentRequest request);
}
