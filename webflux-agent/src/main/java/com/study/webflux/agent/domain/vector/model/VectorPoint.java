package com.study.webflux.agent.domain.vector.model;

import java.util.List;
import java.util.Map;

public record VectorPoint(
	String id,
	List<Float> vector,
	Map<String, Object> payload
) {
	public VectorPoint {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("id cannot be null or blank");
		}
		if (vector == null || vector.isEmpty()) {
			throw new IllegalArgumentException("vector cannot be null or empty");
		}
		vector = List.copyOf(vector);
		payload = payload == null ? Map.of() : Map.copyOf(payload);
	}
}
