package io.toolmesh.core.provider;

import java.util.concurrent.CompletableFuture;

public interface LlmGateway {
    String name();

    CompletableFuture<LlmCompletion> complete(LlmRequest request);
}
