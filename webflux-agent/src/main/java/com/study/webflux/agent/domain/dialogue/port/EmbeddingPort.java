package com.study.webflux.agent.domain.dialogue.port;

import com.study.webflux.agent.domain.dialogue.model.Embedding;
import reactor.core.publisher.Mono;

public interface EmbeddingPort {

	Mono<Embedding> embed(String text);
}
