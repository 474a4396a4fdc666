package com.study.webflux.agent.domain.dialogue.model;

import java.util.ArrayList;
import java.util.List;

public record CompletionRequest(
	List<Message> messages,
	String model
) {
	public CompletionRequest {
		if (messages == null || messages.isEmpty()) {
			throw new IllegalArgumentException("messages cannot be null or empty");
		}
		messages = List.copyOf(messages);
	}

	public static CompletionRequest withMessages(List<Message> messages, String model) {
		return new CompletionRequest(messages, model);
	}

	/**
	 * 선택적인 시스템 프롬프트와 사용자 프롬프트로 요청을 만듭니다.
	 */
	public static CompletionRequest of(String systemPrompt, String userPrompt, String model) {
		List<Message> messages = new ArrayList<>(2);
		if (systemPrompt != null && !systemPrompt.isBlank()) {
			messages.add(Message.system(systemPrompt));
		}
		messages.add(Message.user(userPrompt));
		return new CompletionRequest(messages, model);
	}

	public String userPrompt() {
		for (int i = messages.size() - 1; i >= 0; i--) {
			if (messages.get(i).role() == MessageRole.USER) {
				return messages.get(i).content();
			}
		}
		return "";
	}
}
