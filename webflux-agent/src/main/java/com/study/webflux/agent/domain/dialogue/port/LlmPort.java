package com.study.webflux.agent.domain.dialogue.port;

import com.study.webflux.agent.domain.dialogue.model.CompletionRequest;
import reactor.core.publisher.Mono;

public interface LlmPort {

	Mono<String> complete(CompletionRequest request);
}
