package com.study.webflux.agent.application.config.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.study.webflux.agent.domain.config.model.ConfigSource;
import reactor.core.publisher.Mono;

/**
 * 로컬 프롬프트 파일이 수정되면 로컬 설정을 다시 읽습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "agent.config.watch", name = "enabled", havingValue = "true")
public class ConfigRefreshScheduler {

	private final ConfigStoreService configStoreService;

	@Scheduled(fixedDelayString = "${agent.config.watch.interval:PT10S}",
		initialDelayString = "${agent.config.watch.interval:PT10S}")
	public void refreshIfModified() {
		refresh().subscribe();
	}

	Mono<Void> refresh() {
		return configStoreService.isLocalModified()
			.filter(Boolean::booleanValue)
			.doOnNext(modified -> log.info("로컬 프롬프트 파일 변경 감지, 리로드를 시작합니다"))
			.flatMap(modified -> configStoreService.reload(ConfigSource.LOCAL))
			.doOnError(error -> log.error("로컬 설정 자동 리로드 실패 이유={}", error.getMessage(), error))
			.onErrorResume(error -> Mono.empty())
			.then();
	}
}
