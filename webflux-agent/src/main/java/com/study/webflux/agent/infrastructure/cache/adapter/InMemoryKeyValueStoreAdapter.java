package com.study.webflux.agent.infrastructure.cache.adapter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.study.webflux.agent.domain.cache.port.KeyValueStorePort;
import reactor.core.publisher.Mono;

/** 프로세스 메모리 캐시입니다. 만료된 항목은 조회 시점에 제거합니다. */
@Component
@ConditionalOnProperty(prefix = "agent.cache", name = "key-value-backend", havingValue = "memory")
public class InMemoryKeyValueStoreAdapter implements KeyValueStorePort {

	private final Map<String, StoredValue> values = new ConcurrentHashMap<>();
	private final Clock clock;

	public InMemoryKeyValueStoreAdapter(Clock clock) {
		this.clock = clock;
	}

	@Override
	public Mono<String> get(String key) {
		return Mono.fromCallable(() -> {
			StoredValue stored = values.get(key);
			if (stored == null) {
				return null;
			}
			if (stored.isExpired(clock.instant())) {
				values.remove(key, stored);
				return null;
			}
			return stored.value();
		});
	}

	@Override
	public Mono<Void> set(String key, String value, Duration ttl) {
		return Mono.fromRunnable(() -> {
			Instant expiresAt = ttl == null ? null : clock.instant().plus(ttl);
			values.put(key, new StoredValue(value, expiresAt));
		});
	}

	@Override
	public Mono<Boolean> delete(String key) {
		return Mono.fromCallable(() -> values.remove(key) != null);
	}

	private record StoredValue(String value, Instant expiresAt) {

		boolean isExpired(Instant now) {
			return expiresAt != null && !now.isBefore(expiresAt);
		}
	}
}
