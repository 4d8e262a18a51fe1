package com.docweaver.core.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps collaborator-native failures onto {@link TransientAgentException} and
 * {@link FatalAgentException}. This is the only class that knows how the
 * backends fail; everything downstream sees just the two buckets.
 */
@Component
public class AgentErrorClassifier {

    public AgentException classify(AgentRole role, Throwable error) {
        Throwable cause = unwrap(error);

        if (cause instanceof AgentException agentException) {
            return agentException;
        }
        if (cause instanceof HttpAgentException http) {
            return classifyStatus(role, http);
        }
        if (cause instanceof TimeoutException || cause instanceof HttpTimeoutException) {
            return new TransientAgentException(TransientAgentException.TIMEOUT,
                    role.wireName() + " timed out", cause);
        }
        if (cause instanceof JsonProcessingException) {
            return new FatalAgentException(FatalAgentException.MALFORMED,
                    role.wireName() + " returned a malformed payload", cause);
        }
        if (cause instanceof IOException) {
            return new TransientAgentException(TransientAgentException.NETWORK,
                    role.wireName() + " unreachable: " + cause.getMessage(), cause);
        }
        if (cause instanceof IllegalArgumentException) {
            return new FatalAgentException(FatalAgentException.REJECTED,
                    role.wireName() + " rejected the request: " + cause.getMessage(), cause);
        }
        return new FatalAgentException(FatalAgentException.FAILED,
                role.wireName() + " failed: " + describe(cause), cause);
    }

    private AgentException classifyStatus(AgentRole role, HttpAgentException http) {
        int status = http.statusCode();
        return switch (status) {
            case 429 -> new TransientAgentException(TransientAgentException.RATE_LIMITED,
                    role.wireName() + " rate limited (HTTP 429)", http);
            case 408, 502, 503, 504 -> new TransientAgentException(TransientAgentException.UNAVAILABLE,
                    role.wireName() + " unavailable (HTTP " + status + ")", http);
            default -> new FatalAgentException(
                    status >= 400 && status < 500 ? FatalAgentException.REJECTED : FatalAgentException.FAILED,
                    role.wireName() + " failed (HTTP " + status + ")", http);
        };
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
