package com.study.webflux.agent.application.gateway.auth;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

import lombok.extern.slf4j.Slf4j;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.server.RequestUpgradeStrategy;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.server.ServerWebExchange;

import com.study.webflux.agent.domain.gateway.exception.AuthException;
import com.study.webflux.agent.domain.gateway.model.AuthenticatedIdentity;
import reactor.core.publisher.Mono;

/**
 * 업그레이드 전에 핸드셰이크 인증을 수행합니다. 인증에 실패하면 웹소켓으로 전환하지 않고 401을 응답합니다.
 *
 * <p>
 * 인증된 식별자는 WebSession 속성으로 기록되고, 세션 속성 필터를 통해 웹소켓 세션 속성으로 복사됩니다.
 */
@Slf4j
public class AuthenticatingHandshakeWebSocketService extends HandshakeWebSocketService {

	public static final String IDENTITY_ATTRIBUTE = "agent.gateway.identity";

	private final HandshakeAuthenticator authenticator;

	public AuthenticatingHandshakeWebSocketService(RequestUpgradeStrategy upgradeStrategy,
		HandshakeAuthenticator authenticator) {
		super(upgradeStrategy);
		this.authenticator = authenticator;
		setSessionAttributePredicate(IDENTITY_ATTRIBUTE::equals);
	}

	@Override
	public Mono<Void> handleRequest(ServerWebExchange exchange, WebSocketHandler handler) {
		MultiValueMap<String, String> params = exchange.getRequest().getQueryParams();
		AuthenticatedIdentity identity;
		try {
			identity = authenticator.authenticate(params.getFirst("ts"), params.getFirst("sig"));
		} catch (AuthException e) {
			log.warn("핸드셰이크 인증 거부 reason={}, remote={}", e.getReason(),
				exchange.getRequest().getRemoteAddress());
			return reject(exchange, e);
		}
		return exchange.getSession()
			.doOnNext(session -> session.getAttributes().put(IDENTITY_ATTRIBUTE, identity))
			.then(Mono.defer(() -> super.handleRequest(exchange, handler)));
	}

	private Mono<Void> reject(ServerWebExchange exchange, AuthException error) {
		ServerHttpResponse response = exchange.getResponse();
		response.setStatusCode(HttpStatus.UNAUTHORIZED);
		response.getHeaders().setContentType(MediaType.TEXT_PLAIN);
		byte[] body = ("Unauthorized: " + error.getReason().name().toLowerCase(Locale.ROOT) + ": "
			+ error.getMessage()).getBytes(StandardCharsets.UTF_8);
		DataBuffer buffer = response.bufferFactory().wrap(body);
		return response.writeWith(Mono.just(buffer));
	}
}
