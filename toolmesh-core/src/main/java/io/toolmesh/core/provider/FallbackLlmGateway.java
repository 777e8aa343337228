package io.toolmesh.core.provider;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FallbackLlmGateway implements LlmGateway {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackLlmGateway.class);
    private final String name;
    private final List<LlmGateway> chain;

    public FallbackLlmGateway(String name, List<LlmGateway> chain) {
        this.name = name;
        this.chain = List.copyOf(chain);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletableFuture<LlmCompletion> complete(LlmRequest request) {
        if (chain.isEmpty()) {
            return CompletableFuture.failedFuture(new LlmGatewayException(name, "no providers in fallback chain"));
        }
        return attempt(0, request);
    }

    private CompletableFuture<LlmCompletion> attempt(int index, LlmRequest request) {
        LlmGateway gateway = chain.get(index);
        CompletableFuture<LlmCompletion> started;
        try {
            started = gateway.complete(request);
        } catch (RuntimeException e) {
            started = CompletableFuture.failedFuture(e);
        }
        return started.<CompletableFuture<LlmCompletion>>handle((completion, error) -> {
            if (error == null) {
                LOG.debug("Provider {} served request for chain {}", gateway.name(), name);
                return CompletableFuture.completedFuture(completion);
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            LOG.warn("Provider {} failed in chain {}: {}", gateway.name(), name, truncate(cause.getMessage(), 300));
            if (index + 1 < chain.size()) {
                return attempt(index + 1, request);
            }
            return CompletableFuture.<LlmCompletion>failedFuture(cause);
        }).thenCompose(next -> next);
    }

    private String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
