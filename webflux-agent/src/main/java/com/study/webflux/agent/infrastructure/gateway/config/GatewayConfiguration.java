package com.study.webflux.agent.infrastructure.gateway.config;

import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.reactive.socket.server.upgrade.ReactorNettyRequestUpgradeStrategy;

import com.study.webflux.agent.application.gateway.auth.AuthenticatingHandshakeWebSocketService;
import com.study.webflux.agent.application.gateway.auth.HandshakeAuthenticator;
import com.study.webflux.agent.application.gateway.handler.AgentWebSocketHandler;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import reactor.netty.http.server.WebsocketServerSpec;

/**
 * 웹소켓 엔드포인트를 등록하고 WebFlux 기본 WebSocketService를 인증 핸드셰이크 서비스로 교체합니다.
 */
@Configuration
public class GatewayConfiguration implements WebFluxConfigurer {

	private final HandshakeAuthenticator authenticator;
	private final AgentProperties properties;

	public GatewayConfiguration(HandshakeAuthenticator authenticator, AgentProperties properties) {
		this.authenticator = authenticator;
		this.properties = properties;
	}

	@Bean
	public HandlerMapping agentWebSocketHandlerMapping(AgentWebSocketHandler handler) {
		return new SimpleUrlHandlerMapping(Map.of(properties.getGateway().getPath(), handler), -1);
	}

	@Override
	public WebSocketService getWebSocketService() {
		int frameLimit = frameLimit(properties.getGateway().getMaxMessageBytes());
		ReactorNettyRequestUpgradeStrategy upgradeStrategy = new ReactorNettyRequestUpgradeStrategy(
			() -> WebsocketServerSpec.builder().maxFramePayloadLength(frameLimit));
		return new AuthenticatingHandshakeWebSocketService(upgradeStrategy, authenticator);
	}

	/** 애플리케이션 크기 검사가 먼저 동작하도록 Netty 프레임 제한은 여유를 둡니다. */
	static int frameLimit(int maxMessageBytes) {
		long doubled = (long)maxMessageBytes * 2;
		return (int)Math.min(doubled, Integer.MAX_VALUE);
	}
}
