package com.study.webflux.agent.fixture;

import java.time.Instant;

import com.study.webflux.agent.domain.dialogue.model.ConversationId;
import com.study.webflux.agent.domain.dialogue.model.ConversationTurn;
import com.study.webflux.agent.domain.dialogue.model.MessageRole;

public final class ConversationTurnFixture {

	public static final String DEFAULT_QUESTION = "내 주문 상태 알려줘";
	public static final String DEFAULT_ANSWER = "주문은 배송 중입니다.";

	private ConversationTurnFixture() {
	}

	public static ConversationId conversationId() {
		return ConversationId.of("conversation-1");
	}

	public static ConversationTurn user(Instant createdAt) {
		return new ConversationTurn(null, conversationId(), MessageRole.USER, DEFAULT_QUESTION, createdAt);
	}

	public static ConversationTurn assistant(Instant createdAt) {
		return new ConversationTurn(null, conversationId(), MessageRole.ASSISTANT, DEFAULT_ANSWER,
			createdAt);
	}
}
