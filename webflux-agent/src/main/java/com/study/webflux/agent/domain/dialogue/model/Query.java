package com.study.webflux.agent.domain.dialogue.model;

/**
 * 연결 단위 대화 식별자와 함께 전달된 사용자 질의입니다.
 */
public record Query(
	ConversationId conversationId,
	String text
) {
	public Query {
		if (conversationId == null) {
			throw new IllegalArgumentException("conversationId cannot be null");
		}
		if (text == null || text.isBlank()) {
			throw new IllegalArgumentException("text cannot be null or blank");
		}
	}

	public static Query of(ConversationId conversationId, String text) {
		return new Query(conversationId, text);
	}
}
