package com.study.webflux.agent.infrastructure.cache.adapter;

import java.time.Duration;

import lombok.RequiredArgsConstructor;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;

import com.study.webflux.agent.domain.cache.port.KeyValueStorePort;
import reactor.core.publisher.Mono;

/** Redis 문자열 값으로 정확 일치 캐시를 보관하는 어댑터입니다. */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "agent.cache", name = "key-value-backend", havingValue = "redis", matchIfMissing = true)
public class RedisKeyValueStoreAdapter implements KeyValueStorePort {

	private final ReactiveStringRedisTemplate redisTemplate;

	@Override
	public Mono<String> get(String key) {
		return redisTemplate.opsForValue().get(key);
	}

	/** ttl이 null이면 만료 없이 저장합니다. */
	@Override
	public Mono<Void> set(String key, String value, Duration ttl) {
		Mono<Boolean> write = ttl == null
			? redisTemplate.opsForValue().set(key, value)
			: redisTemplate.opsForValue().set(key, value, ttl);
		return write.then();
	}

	@Override
	public Mono<Boolean> delete(String key) {
		return redisTemplate.delete(key).map(count -> count > 0);
	}
}
