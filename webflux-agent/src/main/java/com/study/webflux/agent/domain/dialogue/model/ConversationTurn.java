package com.study.webflux.agent.domain.dialogue.model;

import java.time.Instant;

public record ConversationTurn(
	String id,
	ConversationId conversationId,
	MessageRole role,
	String content,
	Instant createdAt
) {
	public ConversationTurn {
		if (conversationId == null) {
			throw new IllegalArgumentException("conversationId cannot be null");
		}
		if (role == null) {
			throw new IllegalArgumentException("role cannot be null");
		}
		if (content == null) {
			throw new IllegalArgumentException("content cannot be null");
		}
		if (createdAt == null) {
			createdAt = Instant.now();
		}
	}

	public static ConversationTurn user(ConversationId conversationId, String content) {
		return new ConversationTurn(null, conversationId, MessageRole.USER, content, Instant.now());
	}

	public static ConversationTurn assistant(ConversationId conversationId, String content) {
		return new ConversationTurn(null, conversationId, MessageRole.ASSISTANT, content,
			Instant.now());
	}

	public static ConversationTurn withId(String id,
		ConversationId conversationId,
		MessageRole role,
		String content,
		Instant createdAt) {
		return new ConversationTurn(id, conversationId, role, content, createdAt);
	}
}
