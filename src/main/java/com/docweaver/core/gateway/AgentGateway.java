package com.docweaver.core.gateway;

import com.docweaver.core.metrics.DocweaverMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Uniform entry point to the external collaborators.
 *
 * <p>Resolves a role through the role table, invokes the bound backend, and normalizes
 * the outcome: the returned future either completes with an {@link AgentResponse} or
 * fails with exactly one of {@link TransientAgentException} / {@link FatalAgentException}.
 */
public class AgentGateway {

    private static final Logger log = LoggerFactory.getLogger(AgentGateway.class);

    private final Map<AgentRole, AgentBackend> roleTable;
    private final AgentErrorClassifier classifier;
    private final DocweaverMetrics metrics;

    public AgentGateway(Map<AgentRole, AgentBackend> backends, AgentErrorClassifier classifier,
                        DocweaverMetrics metrics) {
        this.roleTable = backends.isEmpty() ? new EnumMap<>(AgentRole.class) : new EnumMap<>(backends);
        this.classifier = classifier;
        this.metrics = metrics;
    }

    public Set<AgentRole> boundRoles() {
        return Collections.unmodifiableSet(roleTable.keySet());
    }

    public CompletableFuture<AgentResponse> invoke(AgentRole role, AgentRequest request) {
        var result = new CompletableFuture<AgentResponse>();
        AgentBackend backend = roleTable.get(role);
        if (backend == null) {
            result.completeExceptionally(new FatalAgentException(FatalAgentException.UNBOUND,
                    "No backend bound for role " + role.wireName()));
            return result;
        }

        long startMs = System.currentTimeMillis();
        CompletableFuture<AgentResponse> call;
        try {
            call = backend.call(request);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        if (call == null) {
            call = CompletableFuture.failedFuture(new FatalAgentException(FatalAgentException.MALFORMED,
                    role.wireName() + " backend returned no future"));
        }

        call.whenComplete((response, error) -> {
            long elapsedMs = System.currentTimeMillis() - startMs;
            if (error == null && response == null) {
                error = new FatalAgentException(FatalAgentException.MALFORMED,
                        role.wireName() + " returned an empty response");
            }
            if (error != null) {
                AgentException classified = classifier.classify(role, error);
                log.debug("Agent call {} [{}] failed after {}ms: {} ({})", request.unitId(), role.wireName(),
                        elapsedMs, classified.getMessage(), classified.kind());
                metrics.recordAgentCall(role.wireName(), classified.kind().name().toLowerCase(Locale.ROOT), elapsedMs);
                result.completeExceptionally(classified);
            } else {
                metrics.recordAgentCall(role.wireName(), "success", elapsedMs);
                result.complete(response);
            }
        });

        // Propagate abandonment of the normalized future to the backend call.
        final CompletableFuture<AgentResponse> backendCall = call;
        result.whenComplete((r, e) -> {
            if (result.isCancelled()) {
                backendCall.cancel(true);
            }
        });
        return result;
    }
}
