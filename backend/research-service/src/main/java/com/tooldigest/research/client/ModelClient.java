package com.tooldigest.research.client;

import reactor.core.publisher.Mono;

/**
 * Sends a system and user prompt to a language model and returns the raw text reply.
 * The reply is not interpreted here; see {@link com.tooldigest.research.util.ModelJsonParser}.
 */
public interface ModelClient {

    String name();

    Mono<String> complete(ModelRequest request);
}
