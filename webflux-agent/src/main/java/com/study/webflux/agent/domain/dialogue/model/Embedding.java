package com.study.webflux.agent.domain.dialogue.model;

import java.util.List;

public record Embedding(
	List<Float> vector
) {
	public Embedding {
		if (vector == null || vector.isEmpty()) {
			throw new IllegalArgumentException("vector cannot be null or empty");
		}
		vector = List.copyOf(vector);
	}

	public static Embedding of(float[] values) {
		if (values == null) {
			throw new IllegalArgumentException("vector cannot be null or empty");
		}
		Float[] boxed = new Float[values.length];
		for (int i = 0; i < values.length; i++) {
			boxed[i] = values[i];
		}
		return new Embedding(List.of(boxed));
	}

	public int dimension() {
		return vector.size();
	}
}
