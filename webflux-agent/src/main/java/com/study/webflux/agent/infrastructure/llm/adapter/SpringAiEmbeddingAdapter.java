package com.study.webflux.agent.infrastructure.llm.adapter;

import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;

import com.study.webflux.agent.domain.dialogue.model.Embedding;
import com.study.webflux.agent.domain.dialogue.port.EmbeddingPort;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/** Spring AI EmbeddingModel로 텍스트 임베딩을 계산합니다. */
@Component
public class SpringAiEmbeddingAdapter implements EmbeddingPort {

	private final EmbeddingModel embeddingModel;

	public SpringAiEmbeddingAdapter(EmbeddingModel embeddingModel) {
		this.embeddingModel = embeddingModel;
	}

	@Override
	public Mono<Embedding> embed(String text) {
		if (text == null || text.isBlank()) {
			return Mono.error(new IllegalArgumentException("text cannot be null or blank"));
		}
		return Mono.fromCallable(() -> {
			float[] vector = embeddingModel.embed(text);
			if (vector == null || vector.length == 0) {
				throw new IllegalStateException("Embedding model returned an empty vector");
			}
			return Embedding.of(vector);
		}).subscribeOn(Schedulers.boundedElastic());
	}
}
