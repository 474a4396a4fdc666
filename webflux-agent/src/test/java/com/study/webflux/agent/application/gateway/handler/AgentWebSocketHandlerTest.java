package com.study.webflux.agent.application.gateway.handler;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.agent.application.gateway.auth.AuthenticatingHandshakeWebSocketService;
import com.study.webflux.agent.domain.config.model.ConfigSnapshot;
import com.study.webflux.agent.domain.config.port.ConfigStoreUseCase;
import com.study.webflux.agent.domain.dialogue.exception.GenerationException;
import com.study.webflux.agent.domain.dialogue.model.AgentResponse;
import com.study.webflux.agent.domain.dialogue.model.Query;
import com.study.webflux.agent.domain.dialogue.model.ResponseSource;
import com.study.webflux.agent.domain.dialogue.port.AgentPipelineUseCase;
import com.study.webflux.agent.domain.gateway.model.AuthenticatedIdentity;
import com.study.webflux.agent.fixture.AgentPropertiesFixture;
import com.study.webflux.agent.fixture.ConfigSnapshotFixture;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import com.study.webflux.agent.infrastructure.monitoring.config.AgentMetricsConfiguration;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentWebSocketHandlerTest {

	@Mock
	private AgentPipelineUseCase pipeline;

	@Mock
	private ConfigStoreUseCase configStore;

	@Mock
	private WebSocketSession session;

	private final ConfigSnapshot snapshot = ConfigSnapshotFixture.create();
	private final List<String> sent = new ArrayList<>();
	private final Map<String, Object> attributes = new HashMap<>();
	private SimpleMeterRegistry meterRegistry;
	private AgentWebSocketHandler handler;

	@BeforeEach
	void setUp() {
		meterRegistry = new SimpleMeterRegistry();
		AgentProperties properties = AgentPropertiesFixture.create();
		properties.getGateway().setMaxMessageBytes(64);
		handler = new AgentWebSocketHandler(pipeline, configStore,
			new GatewayMessageCodec(new ObjectMapper()), new AgentMetricsConfiguration(meterRegistry),
			properties);

		lenient().when(session.getId()).thenReturn("session-1");
		lenient().when(session.getAttributes()).thenReturn(attributes);
		lenient().when(session.closeStatus()).thenReturn(Mono.never());
		lenient().when(session.close(any())).thenReturn(Mono.empty());
		lenient().when(session.textMessage(anyString())).thenAnswer(invocation -> text(invocation.getArgument(0)));
		lenient().when(session.send(any())).thenAnswer(invocation -> {
			Publisher<WebSocketMessage> outbound = invocation.getArgument(0);
			return Flux.from(outbound).doOnNext(message -> sent.add(message.getPayloadAsText())).then();
		});
		lenient().when(configStore.current()).thenReturn(snapshot);
	}

	@Test
	@DisplayName("메시지를 수신 순서대로 처리하고 같은 대화 식별자를 사용한다")
	void handle_processesMessagesInOrder() {
		receive(text("hello"), text("내 주문 상태"));
		when(pipeline.handle(any(), any())).thenAnswer(invocation -> {
			Query query = invocation.getArgument(0);
			return Mono.just(AgentResponse.of("answer:" + query.text(), ResponseSource.GENERATED));
		});

		StepVerifier.create(handler.handle(session)).verifyComplete();

		assertThat(sent).containsExactly("answer:hello", "answer:내 주문 상태");
		ArgumentCaptor<Query> queries = ArgumentCaptor.forClass(Query.class);
		verify(pipeline, times(2)).handle(queries.capture(), any());
		assertThat(queries.getAllValues().get(0).conversationId())
			.isEqualTo(queries.getAllValues().get(1).conversationId());
		verify(session, never()).close(any());
	}

	@Test
	@DisplayName("JSON 요청에는 JSON 응답을 보낸다")
	void handle_jsonEnvelope() {
		receive(text("{\"payload\": \"hello\"}"));
		when(pipeline.handle(any(), any())).thenReturn(Mono.just(
			AgentResponse.of(ConfigSnapshotFixture.GREETING_TEXT, ResponseSource.TEMPLATE)));

		StepVerifier.create(handler.handle(session)).verifyComplete();

		assertThat(sent).singleElement().asString()
			.contains("\"type\":\"response\"")
			.contains("\"source\":\"template\"");
	}

	@Test
	@DisplayName("생성 실패 시 실패 문구로 응답하고 연결을 유지한다")
	void handle_generationFailureKeepsConnection() {
		receive(text("첫 질문"), text("두 번째 질문"));
		when(pipeline.handle(any(), any()))
			.thenReturn(Mono.error(new GenerationException(GenerationException.Reason.TIMEOUT, "timeout")))
			.thenReturn(Mono.just(AgentResponse.of("두 번째 답변", ResponseSource.GENERATED)));

		StepVerifier.create(handler.handle(session)).verifyComplete();

		assertThat(sent).containsExactly(ConfigSnapshotFixture.FAILURE_TEXT, "두 번째 답변");
		verify(session, never()).close(any());
	}

	@Test
	@DisplayName("크기 제한을 넘는 메시지는 오류를 보내고 1009로 연결을 닫는다")
	void handle_oversizedMessageClosesConnection() {
		receive(text("x".repeat(65)), text("hello"));

		StepVerifier.create(handler.handle(session)).verifyComplete();

		assertThat(sent).singleElement().asString().contains("\"type\":\"error\"").contains("too large");
		verify(session).close(CloseStatus.TOO_BIG_TO_PROCESS);
		verifyNoInteractions(pipeline);
		assertThat(meterRegistry.get("agent.gateway.protocol.error").counter().count()).isEqualTo(1.0);
	}

	@Test
	@DisplayName("잘못된 JSON은 오류를 보내고 1003으로 연결을 닫는다")
	void handle_malformedJsonClosesConnection() {
		receive(text("{\"payload\": "));

		StepVerifier.create(handler.handle(session)).verifyComplete();

		verify(session).close(CloseStatus.NOT_ACCEPTABLE);
		verifyNoInteractions(pipeline);
	}

	@Test
	@DisplayName("바이너리 메시지는 지원하지 않으므로 1003으로 연결을 닫는다")
	void handle_binaryMessageClosesConnection() {
		receive(new WebSocketMessage(WebSocketMessage.Type.BINARY,
			DefaultDataBufferFactory.sharedInstance.wrap(new byte[] {1, 2, 3})));

		StepVerifier.create(handler.handle(session)).verifyComplete();

		verify(session).close(CloseStatus.NOT_ACCEPTABLE);
	}

	@Test
	@DisplayName("빈 메시지는 응답 없이 무시한다")
	void handle_blankMessageIgnored() {
		receive(text("   "));

		StepVerifier.create(handler.handle(session)).verifyComplete();

		assertThat(sent).isEmpty();
		verifyNoInteractions(pipeline);
	}

	@Test
	@DisplayName("연결이 끝나면 활성 연결 수를 되돌린다")
	void handle_tracksActiveConnections() {
		attributes.put(AuthenticatingHandshakeWebSocketService.IDENTITY_ATTRIBUTE,
			AuthenticatedIdentity.sharedSecret());
		receive();

		StepVerifier.create(handler.handle(session)).verifyComplete();

		assertThat(meterRegistry.get("agent.gateway.connections.active").gauge().value()).isZero();
	}

	private void receive(WebSocketMessage... messages) {
		when(session.receive()).thenReturn(Flux.just(messages));
	}

	private static WebSocketMessage text(String payload) {
		return new WebSocketMessage(WebSocketMessage.Type.TEXT,
			DefaultDataBufferFactory.sharedInstance.wrap(payload.getBytes(StandardCharsets.UTF_8)));
	}
}
