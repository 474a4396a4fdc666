package com.study.webflux.agent.domain.gateway.model;

import java.time.Instant;

import com.study.webflux.agent.domain.dialogue.model.ConversationId;

/**
 * 활성 연결 하나의 상태입니다. 인증 성공 시 생성되고 연결 종료 시 폐기됩니다.
 */
public record ConnectionSession(
	String sessionId,
	ConversationId conversationId,
	AuthenticatedIdentity identity,
	Instant connectedAt
) {
	public ConnectionSession {
		if (sessionId == null || sessionId.isBlank()) {
			throw new IllegalArgumentException("sessionId cannot be null or blank");
		}
		if (conversationId == null) {
			throw new IllegalArgumentException("conversationId cannot be null");
		}
		if (identity == null) {
			identity = AuthenticatedIdentity.anonymous();
		}
		if (connectedAt == null) {
			connectedAt = Instant.now();
		}
	}

	public static ConnectionSession open(String sessionId, AuthenticatedIdentity identity) {
		return new ConnectionSession(sessionId, ConversationId.generate(), identity, Instant.now());
	}
}
