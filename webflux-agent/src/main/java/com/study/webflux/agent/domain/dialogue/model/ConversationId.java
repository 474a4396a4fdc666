package com.study.webflux.agent.domain.dialogue.model;

import java.util.UUID;

public record ConversationId(
	String value
) {
	public ConversationId {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("conversationId cannot be null or blank");
		}
		if (value.length() > 128) {
			throw new IllegalArgumentException("conversationId too long");
		}
	}

	public static ConversationId of(String value) {
		return new ConversationId(value);
	}

	public static ConversationId generate() {
		return new ConversationId(UUID.randomUUID().toString());
	}
}
