package com.study.webflux.agent.application.config.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.agent.domain.config.exception.ConfigException;
import com.study.webflux.agent.domain.config.model.ConfigSnapshot;
import com.study.webflux.agent.domain.config.model.ConfigSource;
import com.study.webflux.agent.domain.config.model.IndexSchema;
import com.study.webflux.agent.domain.config.model.PromptConfig;
import com.study.webflux.agent.domain.config.model.ReloadReport;
import com.study.webflux.agent.domain.config.model.ReloadStatus;
import com.study.webflux.agent.domain.config.model.RemoteConfigFetch;
import com.study.webflux.agent.domain.config.model.SourceReloadResult;
import com.study.webflux.agent.domain.config.port.ConfigStoreUseCase;
import com.study.webflux.agent.domain.config.port.LocalConfigPort;
import com.study.webflux.agent.domain.config.port.RemoteConfigPort;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import com.study.webflux.agent.infrastructure.monitoring.config.AgentMetricsConfiguration;
import jakarta.annotation.PostConstruct;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 설정 스냅샷을 단일 AtomicReference로 보관하고 소스별 리로드 결과를 병합해 원자적으로 교체합니다.
 */
@Slf4j
@Service
public class ConfigStoreService implements ConfigStoreUseCase {

	private static final Duration STARTUP_TIMEOUT = Duration.ofSeconds(30);

	private final LocalConfigPort localConfigPort;
	private final RemoteConfigPort remoteConfigPort;
	private final PromptConfigParser parser;
	private final AgentMetricsConfiguration metrics;
	private final Clock clock;
	private final Duration remoteTimeout;

	private final AtomicReference<ConfigSnapshot> snapshotRef = new AtomicReference<>(
		ConfigSnapshot.initial());
	private final AtomicReference<String> remoteEtag = new AtomicReference<>();
	private final AtomicReference<Instant> localLoadedAt = new AtomicReference<>();
	private final AtomicReference<PromptConfig> remotePrompts = new AtomicReference<>();

	public ConfigStoreService(LocalConfigPort localConfigPort,
		RemoteConfigPort remoteConfigPort,
		PromptConfigParser parser,
		AgentMetricsConfiguration metrics,
		Clock clock,
		AgentProperties properties) {
		this.localConfigPort = localConfigPort;
		this.remoteConfigPort = remoteConfigPort;
		this.parser = parser;
		this.metrics = metrics;
		this.clock = clock;
		this.remoteTimeout = properties.getConfig().getRemote().getTimeout();
	}

	@PostConstruct
	void loadOnStartup() {
		initialize();
	}

	@Override
	public ConfigSnapshot current() {
		return snapshotRef.get();
	}

	/**
	 * 시작 시 로컬, 원격 순서로 설정을 불러옵니다. 원격 실패 시 로컬 설정으로 동작합니다.
	 *
	 * @throws IllegalStateException
	 *             어느 소스에서도 설정을 불러오지 못한 경우
	 */
	public ReloadReport initialize() {
		ReloadReport report = reload(ConfigSource.BOTH).block(STARTUP_TIMEOUT);
		if (report == null || current().version() == 0L) {
			throw new IllegalStateException("초기 설정을 불러오지 못했습니다: "
				+ (report == null ? "no report" : report.details()));
		}
		log.info("초기 설정 로드 완료 version={}, intents={}, indexes={}",
			current().version(),
			current().promptConfig().intents().keySet(),
			current().indexSchema().names());
		return report;
	}

	@Override
	public Mono<ReloadReport> reload(ConfigSource source) {
		Mono<SourceLoad> local = source.includesLocal() ? loadLocal() : Mono.empty();
		Mono<SourceLoad> remote = source.includesRemote() ? loadRemote() : Mono.empty();

		return Flux.concat(local, remote)
			.collectList()
			.map(this::apply);
	}

	/** 마지막 로컬 로드 이후 로컬 설정 파일이 수정되었는지 확인합니다. 수정 시각을 알 수 없으면 수정된 것으로 봅니다. */
	public Mono<Boolean> isLocalModified() {
		Instant loadedAt = localLoadedAt.get();
		if (loadedAt == null) {
			return Mono.just(true);
		}
		return localConfigPort.lastModified()
			.map(modified -> modified.isAfter(loadedAt))
			.defaultIfEmpty(true);
	}

	/**
	 * 소스별 결과를 하나의 스냅샷으로 병합합니다.
	 *
	 * <p>
	 * 원격 프롬프트는 로컬 프롬프트보다 우선합니다. 이번 리로드에서 원격을 새로 받지 않았더라도 마지막으로 적용한 원격 프롬프트가
	 * 있으면 로컬 프롬프트 대신 그것을 유지합니다.
	 */
	private ReloadReport apply(List<SourceLoad> loads) {
		PromptConfig localPrompts = null;
		PromptConfig freshRemotePrompts = null;
		IndexSchema schema = null;
		for (SourceLoad load : loads) {
			ConfigSource source = load.result().source();
			if (source == ConfigSource.LOCAL) {
				localPrompts = load.promptConfig();
				schema = load.indexSchema();
			} else if (load.promptConfig() != null) {
				freshRemotePrompts = load.promptConfig();
			} else if (load.result().status() == ReloadStatus.DISABLED) {
				remotePrompts.set(null);
			}
		}
		if (freshRemotePrompts != null) {
			remotePrompts.set(freshRemotePrompts);
		}
		PromptConfig retainedRemote = remotePrompts.get();
		PromptConfig prompts = freshRemotePrompts != null
			? freshRemotePrompts
			: localPrompts != null && retainedRemote != null ? retainedRemote : localPrompts;

		ConfigSnapshot applied;
		if (prompts == null && schema == null) {
			applied = snapshotRef.get();
		} else {
			PromptConfig newPrompts = prompts;
			IndexSchema newSchema = schema;
			applied = snapshotRef.updateAndGet(current -> current.next(newPrompts, newSchema));
		}

		List<SourceReloadResult> results = new ArrayList<>(loads.size());
		for (SourceLoad load : loads) {
			load.etag().ifPresent(remoteEtag::set);
			load.localLoadedAt().ifPresent(localLoadedAt::set);
			results.add(load.result());
			metrics.recordReload(load.result());
			if (load.result().isFailure()) {
				log.warn("설정 리로드 실패 source={}, message={}", load.result().source().label(),
					load.result().message());
			}
		}

		ReloadReport report = new ReloadReport(results, applied.version());
		log.info("설정 리로드 결과 success={}, version={}, details={}", report.success(),
			report.snapshotVersion(),
			results.stream().map(SourceReloadResult::describe).toList());
		return report;
	}

	private Mono<SourceLoad> loadLocal() {
		return isLocalModified()
			.onErrorReturn(true)
			.flatMap(modified -> modified
				? readLocal()
				: Mono.just(SourceLoad.of(SourceReloadResult.unchanged(ConfigSource.LOCAL,
					"local configuration not modified"))));
	}

	private Mono<SourceLoad> readLocal() {
		Instant startedAt = clock.instant();
		return Mono.zip(localConfigPort.readPrompts(), localConfigPort.readIndexSchema())
			.map(documents -> new SourceLoad(
				SourceReloadResult.reloaded(ConfigSource.LOCAL,
					"prompts and index schema reloaded"),
				parser.parsePrompts(documents.getT1()),
				parser.parseIndexSchema(documents.getT2()),
				Optional.empty(),
				Optional.of(startedAt)))
			.switchIfEmpty(Mono.error(
				ConfigException.unavailable("local configuration returned no content", null)))
			.onErrorResume(error -> Mono.just(SourceLoad.failed(ConfigSource.LOCAL, error)));
	}

	private Mono<SourceLoad> loadRemote() {
		if (!remoteConfigPort.isEnabled()) {
			return Mono.just(SourceLoad.of(SourceReloadResult.disabled(ConfigSource.REMOTE,
				"remote configuration is disabled")));
		}
		return remoteConfigPort.fetchPrompts(remoteEtag.get())
			.timeout(remoteTimeout)
			.map(this::toRemoteLoad)
			.switchIfEmpty(Mono.error(
				ConfigException.unavailable("remote configuration returned no content", null)))
			.onErrorResume(error -> Mono.just(SourceLoad.failed(ConfigSource.REMOTE, error)));
	}

	private SourceLoad toRemoteLoad(RemoteConfigFetch fetch) {
		if (fetch.notModified()) {
			return SourceLoad.of(SourceReloadResult.unchanged(ConfigSource.REMOTE,
				"remote configuration not modified"));
		}
		return new SourceLoad(
			SourceReloadResult.reloaded(ConfigSource.REMOTE, "prompts reloaded from remote"),
			parser.parsePrompts(fetch.content()),
			null,
			Optional.ofNullable(fetch.etag()),
			Optional.empty());
	}

	static String describeFailure(Throwable error) {
		if (error instanceof ConfigException configException) {
			return switch (configException.getReason()) {
				case INVALID -> "invalid: " + configException.getMessage();
				case SOURCE_UNAVAILABLE -> "source unavailable: " + configException.getMessage();
			};
		}
		if (error instanceof TimeoutException) {
			return "source unavailable: timed out";
		}
		return "source unavailable: " + error.getMessage();
	}

	private record SourceLoad(
		SourceReloadResult result,
		PromptConfig promptConfig,
		IndexSchema indexSchema,
		Optional<String> etag,
		Optional<Instant> localLoadedAt
	) {
		static SourceLoad of(SourceReloadResult result) {
			return new SourceLoad(result, null, null, Optional.empty(), Optional.empty());
		}

		static SourceLoad failed(ConfigSource source, Throwable error) {
			return of(SourceReloadResult.failed(source, describeFailure(error)));
		}
	}
}
