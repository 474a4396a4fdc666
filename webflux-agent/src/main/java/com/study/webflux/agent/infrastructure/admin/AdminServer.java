package com.study.webflux.agent.infrastructure.admin;

import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.http.server.reactive.HttpHandler;
import org.springframework.http.server.reactive.ReactorHttpHandlerAdapter;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.RouterFunctions;

import com.study.webflux.agent.application.admin.controller.AdminRouter;
import com.study.webflux.agent.application.admin.controller.ConfigReloadHandler;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

/**
 * 메인 포트와 분리된 관리 리스너입니다. 인증이 없으므로 기본값은 루프백 주소에만 바인딩합니다.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "agent.admin", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AdminServer implements SmartLifecycle {

	private final ConfigReloadHandler reloadHandler;
	private final AgentProperties.Admin admin;
	private volatile DisposableServer server;

	public AdminServer(ConfigReloadHandler reloadHandler, AgentProperties properties) {
		this.reloadHandler = reloadHandler;
		this.admin = properties.getAdmin();
	}

	@Override
	public void start() {
		HttpHandler httpHandler = RouterFunctions.toHttpHandler(
			AdminRouter.routes(admin.getPath(), reloadHandler));
		server = HttpServer.create()
			.host(admin.getHost())
			.port(admin.getPort())
			.handle(new ReactorHttpHandlerAdapter(httpHandler))
			.bindNow();
		log.info("관리 리스너 시작 address={}, path={}", server.address(), admin.getPath());
	}

	@Override
	public void stop() {
		DisposableServer current = server;
		server = null;
		if (current != null) {
			current.disposeNow();
			log.info("관리 리스너 종료");
		}
	}

	@Override
	public boolean isRunning() {
		return server != null;
	}

	/** 바인딩된 포트입니다. 설정 포트가 0이면 임의 포트가 할당됩니다. */
	public int port() {
		DisposableServer current = server;
		return current != null ? current.port() : -1;
	}
}
