package com.study.webflux.agent.application.config.service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.agent.domain.config.exception.ConfigException;
import com.study.webflux.agent.domain.config.model.ConfigSnapshot;
import com.study.webflux.agent.domain.config.model.ConfigSource;
import com.study.webflux.agent.domain.config.model.ReloadStatus;
import com.study.webflux.agent.domain.config.model.RemoteConfigFetch;
import com.study.webflux.agent.domain.config.port.LocalConfigPort;
import com.study.webflux.agent.domain.config.port.RemoteConfigPort;
import com.study.webflux.agent.fixture.AgentPropertiesFixture;
import com.study.webflux.agent.infrastructure.monitoring.config.AgentMetricsConfiguration;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConfigStoreServiceTest {

	private static final String SCHEMA_JSON = """
        {"indexes": [{"name": "profile", "fields": ["name"]}, {"name": "orders", "fields": ["status"]}]}
        """;

	private static final String REMOTE_PROMPTS_JSON = PromptConfigParserTest.PROMPTS_JSON
		.replace("\"Hello!\"", "\"Hello from remote!\"");

	@Mock
	private LocalConfigPort localConfigPort;

	@Mock
	private RemoteConfigPort remoteConfigPort;

	private SimpleMeterRegistry meterRegistry;
	private ConfigStoreService service;

	@BeforeEach
	void setUp() {
		meterRegistry = new SimpleMeterRegistry();
		service = new ConfigStoreService(localConfigPort,
			remoteConfigPort,
			new PromptConfigParser(new ObjectMapper()),
			new AgentMetricsConfiguration(meterRegistry),
			Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC),
			AgentPropertiesFixture.create());
	}

	@Test
	@DisplayName("원격 설정이 꺼져 있으면 로컬 설정만으로 초기화한다")
	void initialize_loadsLocalWhenRemoteDisabled() {
		givenLocal(PromptConfigParserTest.PROMPTS_JSON, SCHEMA_JSON);
		when(remoteConfigPort.isEnabled()).thenReturn(false);

		var report = service.initialize();

		assertThat(report.success()).isTrue();
		assertThat(report.details()).extracting(result -> result.status())
			.containsExactly(ReloadStatus.RELOADED, ReloadStatus.DISABLED);
		assertThat(service.current().version()).isEqualTo(1L);
		assertThat(service.current().indexSchema().names()).containsExactly("profile", "orders");
		verify(remoteConfigPort, never()).fetchPrompts(any());
	}

	@Test
	@DisplayName("어느 출처에서도 설정을 불러오지 못하면 시작에 실패한다")
	void initialize_failsWithoutAnySource() {
		when(localConfigPort.readPrompts())
			.thenReturn(Mono.error(ConfigException.unavailable("missing", null)));
		when(localConfigPort.readIndexSchema()).thenReturn(Mono.just(SCHEMA_JSON));
		when(remoteConfigPort.isEnabled()).thenReturn(false);

		assertThatThrownBy(() -> service.initialize())
			.isInstanceOf(IllegalStateException.class);
		assertThat(service.current().version()).isZero();
	}

	@Test
	@DisplayName("잘못된 로컬 파일로 리로드하면 기존 스냅샷을 유지하고 실패를 보고한다")
	void reload_keepsPreviousSnapshotOnInvalidLocal() {
		givenLocal(PromptConfigParserTest.PROMPTS_JSON, SCHEMA_JSON);
		when(remoteConfigPort.isEnabled()).thenReturn(false);
		service.initialize();
		ConfigSnapshot before = service.current();

		when(localConfigPort.readPrompts()).thenReturn(Mono.just("{ broken"));

		StepVerifier.create(service.reload(ConfigSource.LOCAL))
			.assertNext(report -> {
				assertThat(report.success()).isFalse();
				assertThat(report.details()).singleElement()
					.satisfies(result -> assertThat(result.message()).startsWith("invalid:"));
				assertThat(report.snapshotVersion()).isEqualTo(before.version());
			})
			.verifyComplete();

		assertThat(service.current()).isSameAs(before);
		assertThat(meterRegistry.get("agent.config.reload")
			.tag("source", "local").tag("status", "failed").counter().count()).isEqualTo(1.0);
	}

	@Test
	@DisplayName("원격 프롬프트는 로컬 프롬프트를 덮어쓰고 인덱스 스키마는 유지한다")
	void reload_remotePromptsOverrideLocal() {
		givenLocal(PromptConfigParserTest.PROMPTS_JSON, SCHEMA_JSON);
		when(remoteConfigPort.isEnabled()).thenReturn(true);
		when(remoteConfigPort.fetchPrompts(isNull()))
			.thenReturn(Mono.just(RemoteConfigFetch.of(REMOTE_PROMPTS_JSON, "\"v1\"")));

		StepVerifier.create(service.reload(ConfigSource.BOTH))
			.assertNext(report -> assertThat(report.success()).isTrue())
			.verifyComplete();

		ConfigSnapshot snapshot = service.current();
		assertThat(snapshot.version()).isEqualTo(1L);
		assertThat(snapshot.promptConfig().findResponseTemplate("greeting"))
			.contains("Hello from remote!");
		assertThat(snapshot.indexSchema().names()).containsExactly("profile", "orders");
	}

	@Test
	@DisplayName("ETag가 같으면 304를 변경 없음으로 처리하고 버전을 올리지 않는다")
	void reload_remoteNotModifiedKeepsVersion() {
		givenLocal(PromptConfigParserTest.PROMPTS_JSON, SCHEMA_JSON);
		when(remoteConfigPort.isEnabled()).thenReturn(true);
		when(remoteConfigPort.fetchPrompts(isNull()))
			.thenReturn(Mono.just(RemoteConfigFetch.of(REMOTE_PROMPTS_JSON, "\"v1\"")));
		service.initialize();
		long version = service.current().version();

		when(remoteConfigPort.fetchPrompts("\"v1\""))
			.thenReturn(Mono.just(RemoteConfigFetch.unchanged("\"v1\"")));

		StepVerifier.create(service.reload(ConfigSource.REMOTE))
			.assertNext(report -> {
				assertThat(report.success()).isTrue();
				assertThat(report.details()).singleElement()
					.satisfies(result -> assertThat(result.status()).isEqualTo(ReloadStatus.UNCHANGED));
			})
			.verifyComplete();

		assertThat(service.current().version()).isEqualTo(version);
	}

	@Test
	@DisplayName("원격 실패는 부분 성공으로 보고하고 로컬 변경은 적용한다")
	void reload_partialWhenRemoteFails() {
		givenLocal(PromptConfigParserTest.PROMPTS_JSON, SCHEMA_JSON);
		when(remoteConfigPort.isEnabled()).thenReturn(true);
		when(remoteConfigPort.fetchPrompts(any()))
			.thenReturn(Mono.error(new IllegalStateException("connection refused")));

		StepVerifier.create(service.reload(ConfigSource.BOTH))
			.assertNext(report -> {
				assertThat(report.success()).isFalse();
				assertThat(report.partial()).isTrue();
				assertThat(report.details().get(1).message())
					.isEqualTo("source unavailable: connection refused");
			})
			.verifyComplete();

		assertThat(service.current().version()).isEqualTo(1L);
	}

	@Test
	@DisplayName("리로드 이전에 가져간 스냅샷은 리로드 후에도 변하지 않는다")
	void reload_doesNotMutateCapturedSnapshot() {
		givenLocal(PromptConfigParserTest.PROMPTS_JSON, SCHEMA_JSON);
		when(remoteConfigPort.isEnabled()).thenReturn(false);
		service.initialize();
		ConfigSnapshot captured = service.current();

		when(localConfigPort.readIndexSchema()).thenReturn(Mono.just("""
            {"indexes": [{"name": "invoices", "fields": []}]}
            """));
		service.reload(ConfigSource.LOCAL).block();

		assertThat(captured.indexSchema().names()).containsExactly("profile", "orders");
		assertThat(service.current().indexSchema().names()).containsExactly("invoices");
		assertThat(service.current().version()).isEqualTo(captured.version() + 1);
	}

	@Test
	@DisplayName("원격이 304를 반환해도 이전에 적용한 원격 프롬프트를 유지한다")
	void reload_bothKeepsRemotePromptsWhenRemoteNotModified() {
		givenLocal(PromptConfigParserTest.PROMPTS_JSON, SCHEMA_JSON);
		when(remoteConfigPort.isEnabled()).thenReturn(true);
		when(remoteConfigPort.fetchPrompts(isNull()))
			.thenReturn(Mono.just(RemoteConfigFetch.of(REMOTE_PROMPTS_JSON, "\"v1\"")));
		when(remoteConfigPort.fetchPrompts("\"v1\""))
			.thenReturn(Mono.just(RemoteConfigFetch.unchanged("\"v1\"")));
		service.initialize();

		StepVerifier.create(service.reload(ConfigSource.BOTH))
			.assertNext(report -> assertThat(report.details()).extracting(result -> result.status())
				.containsExactly(ReloadStatus.RELOADED, ReloadStatus.UNCHANGED))
			.verifyComplete();

		assertThat(service.current().promptConfig().findResponseTemplate("greeting"))
			.contains("Hello from remote!");
	}

	@Test
	@DisplayName("로컬만 리로드해도 원격 프롬프트가 우선하고 이후 원격 304에서도 유지된다")
	void reload_localDoesNotDiscardRemotePrompts() {
		givenLocal(PromptConfigParserTest.PROMPTS_JSON, SCHEMA_JSON);
		when(remoteConfigPort.isEnabled()).thenReturn(true);
		when(remoteConfigPort.fetchPrompts(isNull()))
			.thenReturn(Mono.just(RemoteConfigFetch.of(REMOTE_PROMPTS_JSON, "\"v1\"")));
		when(remoteConfigPort.fetchPrompts("\"v1\""))
			.thenReturn(Mono.just(RemoteConfigFetch.unchanged("\"v1\"")));
		service.initialize();

		when(localConfigPort.readIndexSchema()).thenReturn(Mono.just("""
			{"indexes": [{"name": "invoices", "fields": []}]}
			"""));
		service.reload(ConfigSource.LOCAL).block();

		assertThat(service.current().promptConfig().findResponseTemplate("greeting"))
			.contains("Hello from remote!");
		assertThat(service.current().indexSchema().names()).containsExactly("invoices");

		service.reload(ConfigSource.REMOTE).block();

		assertThat(service.current().promptConfig().findResponseTemplate("greeting"))
			.contains("Hello from remote!");
	}

	@Test
	@DisplayName("로컬 파일이 마지막 로드 이후 수정되지 않았으면 변경 없음으로 보고한다")
	void reload_localUnchangedWhenFilesNotModified() {
		givenLocal(PromptConfigParserTest.PROMPTS_JSON, SCHEMA_JSON);
		when(localConfigPort.lastModified())
			.thenReturn(Mono.just(Instant.parse("2025-12-31T00:00:00Z")));
		when(remoteConfigPort.isEnabled()).thenReturn(false);
		service.initialize();
		long version = service.current().version();

		StepVerifier.create(service.reload(ConfigSource.LOCAL))
			.assertNext(report -> {
				assertThat(report.success()).isTrue();
				assertThat(report.details()).singleElement()
					.satisfies(result -> assertThat(result.status()).isEqualTo(ReloadStatus.UNCHANGED));
			})
			.verifyComplete();

		assertThat(service.current().version()).isEqualTo(version);
		verify(localConfigPort, times(1)).readPrompts();
	}

	private void givenLocal(String prompts, String schema) {
		lenient().when(localConfigPort.readPrompts()).thenReturn(Mono.just(prompts));
		lenient().when(localConfigPort.readIndexSchema()).thenReturn(Mono.just(schema));
		lenient().when(localConfigPort.lastModified()).thenReturn(Mono.empty());
	}
}
