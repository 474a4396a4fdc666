package com.study.webflux.agent.domain.vector.model;

import java.util.Map;
import java.util.Optional;

public record ScoredPoint(
	String id,
	double score,
	Map<String, Object> payload
) {
	public ScoredPoint {
		payload = payload == null ? Map.of() : payload;
	}

	public Optional<String> payloadString(String key) {
		Object value = payload.get(key);
		return value instanceof String text ? Optional.of(text) : Optional.empty();
	}
}
