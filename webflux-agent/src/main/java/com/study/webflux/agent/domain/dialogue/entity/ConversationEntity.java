package com.study.webflux.agent.domain.dialogue.entity;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "conversation_turns")
@CompoundIndexes({
	@CompoundIndex(name = "conversation_time_idx", def = "{'conversationId': 1, 'createdAt': -1}")
})
public record ConversationEntity(
	@Id String id,
	String conversationId,
	String role,
	String content,
	Instant createdAt
) {
}
