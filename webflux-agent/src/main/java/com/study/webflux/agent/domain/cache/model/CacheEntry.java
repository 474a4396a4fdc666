package com.study.webflux.agent.domain.cache.model;

import java.time.Duration;
import java.time.Instant;

import com.study.webflux.agent.domain.dialogue.model.Embedding;

/**
 * 캐시에 기록되는 질의-응답 쌍입니다. ttl이 null이면 만료되지 않습니다.
 */
public record CacheEntry(
	String key,
	Embedding embedding,
	String normalizedQuery,
	String response,
	Instant createdAt,
	Duration ttl
) {
	public CacheEntry {
		if (key == null || key.isBlank()) {
			throw new IllegalArgumentException("key cannot be null or blank");
		}
		if (response == null) {
			throw new IllegalArgumentException("response cannot be null");
		}
		if (createdAt == null) {
			createdAt = Instant.now();
		}
		if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
			ttl = null;
		}
	}
}
