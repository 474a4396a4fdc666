package com.study.webflux.agent.domain.dialogue.model;

/**
 * 요청 하나에 대해 반환되는 단일 응답입니다.
 */
public record AgentResponse(
	String text,
	ResponseSource source
) {
	public AgentResponse {
		if (text == null) {
			throw new IllegalArgumentException("text cannot be null");
		}
		if (source == null) {
			throw new IllegalArgumentException("source cannot be null");
		}
	}

	public static AgentResponse of(String text, ResponseSource source) {
		return new AgentResponse(text, source);
	}
}
