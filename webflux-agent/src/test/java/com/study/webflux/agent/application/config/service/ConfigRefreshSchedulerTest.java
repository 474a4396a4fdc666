package com.study.webflux.agent.application.config.service;

import java.util.List;

import com.study.webflux.agent.domain.config.exception.ConfigException;
import com.study.webflux.agent.domain.config.model.ConfigSource;
import com.study.webflux.agent.domain.config.model.ReloadReport;
import com.study.webflux.agent.domain.config.model.SourceReloadResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConfigRefreshSchedulerTest {

	@Mock
	private ConfigStoreService configStoreService;

	private ConfigRefreshScheduler scheduler;

	@BeforeEach
	void setUp() {
		scheduler = new ConfigRefreshScheduler(configStoreService);
	}

	@Test
	@DisplayName("파일이 수정되었으면 로컬 설정을 리로드한다")
	void refresh_reloadsWhenModified() {
		when(configStoreService.isLocalModified()).thenReturn(Mono.just(true));
		when(configStoreService.reload(ConfigSource.LOCAL)).thenReturn(Mono.just(new ReloadReport(
			List.of(SourceReloadResult.reloaded(ConfigSource.LOCAL, "")), 2L)));

		StepVerifier.create(scheduler.refresh()).verifyComplete();

		verify(configStoreService).reload(ConfigSource.LOCAL);
	}

	@Test
	@DisplayName("수정되지 않았으면 리로드하지 않는다")
	void refresh_skipsWhenUnchanged() {
		when(configStoreService.isLocalModified()).thenReturn(Mono.just(false));

		StepVerifier.create(scheduler.refresh()).verifyComplete();

		verify(configStoreService, never()).reload(any());
	}

	@Test
	@DisplayName("수정 시각 확인 실패는 스케줄을 중단시키지 않는다")
	void refresh_swallowsErrors() {
		when(configStoreService.isLocalModified())
			.thenReturn(Mono.error(ConfigException.unavailable("Cannot stat prompts.json", null)));

		StepVerifier.create(scheduler.refresh()).verifyComplete();
	}
}
