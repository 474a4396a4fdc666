package com.study.webflux.agent.domain.cache.port;

import java.time.Duration;

import reactor.core.publisher.Mono;

/**
 * 키-값 캐시 백엔드입니다.
 */
public interface KeyValueStorePort {

	Mono<String> get(String key);

	/**
	 * 값을 저장합니다.
	 *
	 * @param key
	 *            저장 키
	 * @param value
	 *            저장 값
	 * @param ttl
	 *            만료 시간, null이면 만료되지 않음
	 */
	Mono<Void> set(String key, String value, Duration ttl);

	Mono<Boolean> delete(String key);
}
