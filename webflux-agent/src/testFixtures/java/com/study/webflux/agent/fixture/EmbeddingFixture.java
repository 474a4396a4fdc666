package com.study.webflux.agent.fixture;

import com.study.webflux.agent.domain.dialogue.model.Embedding;

public final class EmbeddingFixture {

	private EmbeddingFixture() {
	}

	public static Embedding create() {
		return Embedding.of(new float[] {0.1f, 0.2f, 0.3f});
	}

	public static Embedding of(float... values) {
		return Embedding.of(values);
	}
}
