package com.study.webflux.agent.application.admin.controller;

import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;

/**
 * 관리 리스너 전용 라우트입니다. 메인 애플리케이션 컨텍스트의 라우터로 등록되지 않습니다.
 */
public final class AdminRouter {

	private AdminRouter() {
	}

	public static RouterFunction<ServerResponse> routes(String reloadPath, ConfigReloadHandler handler) {
		return RouterFunctions.route()
			.GET(reloadPath, handler::reload)
			.POST(reloadPath, handler::reload)
			.build();
	}
}
