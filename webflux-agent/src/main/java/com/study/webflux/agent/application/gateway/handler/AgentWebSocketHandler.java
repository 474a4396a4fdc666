package com.study.webflux.agent.application.gateway.handler;

import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.study.webflux.agent.application.agent.pipeline.PromptDefaults;
import com.study.webflux.agent.application.gateway.auth.AuthenticatingHandshakeWebSocketService;
import com.study.webflux.agent.domain.config.model.ConfigSnapshot;
import com.study.webflux.agent.domain.config.port.ConfigStoreUseCase;
import com.study.webflux.agent.domain.dialogue.exception.GenerationException;
import com.study.webflux.agent.domain.dialogue.model.Query;
import com.study.webflux.agent.domain.dialogue.port.AgentPipelineUseCase;
import com.study.webflux.agent.domain.gateway.exception.ProtocolException;
import com.study.webflux.agent.domain.gateway.model.AuthenticatedIdentity;
import com.study.webflux.agent.domain.gateway.model.ConnectionSession;
import com.study.webflux.agent.domain.gateway.model.InboundMessage;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import com.study.webflux.agent.infrastructure.monitoring.config.AgentMetricsConfiguration;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 연결 하나의 수신 루프입니다.
 *
 * <p>
 * 메시지는 수신 순서대로 하나씩 파이프라인에 전달됩니다. 프로토콜 오류는 오류 메시지를 보낸 뒤 연결을 닫고, 생성 실패는 일반
 * 실패 문구로 응답한 뒤 연결을 유지합니다. 연결이 닫히면 처리 중인 요청도 취소됩니다.
 */
@Slf4j
@Component
public class AgentWebSocketHandler implements WebSocketHandler {

	private final AgentPipelineUseCase pipeline;
	private final ConfigStoreUseCase configStore;
	private final GatewayMessageCodec codec;
	private final AgentMetricsConfiguration metrics;
	private final int maxMessageBytes;

	public AgentWebSocketHandler(AgentPipelineUseCase pipeline,
		ConfigStoreUseCase configStore,
		GatewayMessageCodec codec,
		AgentMetricsConfiguration metrics,
		AgentProperties properties) {
		this.pipeline = pipeline;
		this.configStore = configStore;
		this.codec = codec;
		this.metrics = metrics;
		this.maxMessageBytes = properties.getGateway().getMaxMessageBytes();
	}

	@Override
	public Mono<Void> handle(WebSocketSession session) {
		ConnectionSession connection = ConnectionSession.open(session.getId(), identityOf(session));
		AtomicReference<CloseStatus> closeStatus = new AtomicReference<>();
		metrics.connectionOpened();
		log.info("게이트웨이 연결 수립 sessionId={}, conversationId={}, principal={}",
			connection.sessionId(), connection.conversationId().value(),
			connection.identity().principal());

		Flux<WebSocketMessage> outbound = session.receive()
			.map(GatewayFrame::from)
			.concatMap(frame -> process(connection, frame))
			.takeUntilOther(session.closeStatus())
			.onErrorResume(ProtocolException.class, error -> {
				closeStatus.set(closeStatusFor(error));
				metrics.recordProtocolError();
				log.warn("프로토콜 오류로 연결을 종료합니다 sessionId={}, reason={}, message={}",
					connection.sessionId(), error.getReason(), error.getMessage());
				return Mono.just(codec.encodeError(error.getMessage()));
			})
			.map(session::textMessage);

		return session.send(outbound)
			.then(Mono.defer(() -> {
				CloseStatus status = closeStatus.get();
				return status != null ? session.close(status) : Mono.empty();
			}))
			.doFinally(signal -> {
				metrics.connectionClosed();
				log.info("게이트웨이 연결 종료 sessionId={}, signal={}", connection.sessionId(), signal);
			});
	}

	private Mono<String> process(ConnectionSession connection, GatewayFrame frame) {
		if (frame.type() == WebSocketMessage.Type.PING || frame.type() == WebSocketMessage.Type.PONG) {
			return Mono.empty();
		}
		if (frame.type() == WebSocketMessage.Type.BINARY) {
			return Mono.error(ProtocolException.malformed("Binary messages are not supported"));
		}
		if (frame.size() > maxMessageBytes) {
			return Mono.error(ProtocolException.oversized(frame.size(), maxMessageBytes));
		}
		InboundMessage inbound;
		try {
			inbound = codec.decode(frame.text());
		} catch (ProtocolException e) {
			return Mono.error(e);
		}
		if (inbound.isBlank()) {
			return Mono.empty();
		}
		ConfigSnapshot snapshot = configStore.current();
		return pipeline.handle(Query.of(connection.conversationId(), inbound.text()), snapshot)
			.map(response -> codec.encodeResponse(response, inbound))
			.onErrorResume(error -> {
				if (!(error instanceof GenerationException)) {
					log.error("요청 처리 중 예기치 않은 오류 sessionId={}", connection.sessionId(), error);
				}
				return Mono.just(codec.encodeFailure(
					PromptDefaults.generationFailure(snapshot.promptConfig()), inbound));
			});
	}

	private AuthenticatedIdentity identityOf(WebSocketSession session) {
		Object identity = session.getAttributes()
			.get(AuthenticatingHandshakeWebSocketService.IDENTITY_ATTRIBUTE);
		return identity instanceof AuthenticatedIdentity authenticated
			? authenticated
			: AuthenticatedIdentity.anonymous();
	}

	private CloseStatus closeStatusFor(ProtocolException error) {
		return error.getReason() == ProtocolException.Reason.OVERSIZED_MESSAGE
			? CloseStatus.TOO_BIG_TO_PROCESS
			: CloseStatus.NOT_ACCEPTABLE;
	}

	/**
	 * 수신 즉시 페이로드를 복사한 프레임입니다. 버퍼는 concatMap 대기 중 해제될 수 있습니다.
	 */
	private record GatewayFrame(WebSocketMessage.Type type, String text, int size) {

		static GatewayFrame from(WebSocketMessage message) {
			int size = message.getPayload().readableByteCount();
			String text = message.getType() == WebSocketMessage.Type.TEXT
				? message.getPayloadAsText()
				: null;
			return new GatewayFrame(message.getType(), text, size);
		}
	}
}
