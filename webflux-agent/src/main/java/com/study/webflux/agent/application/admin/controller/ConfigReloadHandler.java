package com.study.webflux.agent.application.admin.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;

import com.study.webflux.agent.application.admin.dto.ReloadResponse;
import com.study.webflux.agent.domain.config.model.ConfigSource;
import com.study.webflux.agent.domain.config.port.ConfigStoreUseCase;
import reactor.core.publisher.Mono;

/**
 * 관리 포트의 설정 재적재 요청을 처리합니다. 모든 출처가 성공하면 200, 하나라도 실패하면 400을 응답합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigReloadHandler {

	private final ConfigStoreUseCase configStore;

	public Mono<ServerResponse> reload(ServerRequest request) {
		ConfigSource source;
		try {
			source = ConfigSource.fromParameter(request.queryParam("source").orElse(null));
		} catch (IllegalArgumentException e) {
			log.warn("알 수 없는 재적재 출처 요청 source={}", request.queryParam("source").orElse(""));
			return ServerResponse.badRequest()
				.contentType(MediaType.APPLICATION_JSON)
				.bodyValue(ReloadResponse.rejected(e.getMessage()));
		}
		log.info("설정 재적재 요청 source={}", source.label());
		return configStore.reload(source)
			.flatMap(report -> (report.success() ? ServerResponse.ok() : ServerResponse.badRequest())
				.contentType(MediaType.APPLICATION_JSON)
				.bodyValue(ReloadResponse.from(report)));
	}
}
