package com.study.webflux.agent.domain.config.port;

import java.time.Instant;

import reactor.core.publisher.Mono;

/**
 * 로컬 파일 기반 설정 소스입니다.
 */
public interface LocalConfigPort {

	Mono<String> readPrompts();

	Mono<String> readIndexSchema();

	/**
	 * 프롬프트 파일과 인덱스 스키마 파일 중 가장 최근 수정 시각을 반환합니다. 알 수 없으면 빈 Mono를 반환합니다.
	 */
	Mono<Instant> lastModified();
}
