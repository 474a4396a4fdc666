package com.study.webflux.agent.domain.gateway.model;

/**
 * 디코딩된 수신 메시지입니다. json이 true이면 응답도 JSON으로 보냅니다.
 */
public record InboundMessage(
	String text,
	boolean json
) {
	public InboundMessage {
		if (text == null) {
			throw new IllegalArgumentException("text cannot be null");
		}
	}

	public static InboundMessage plain(String text) {
		return new InboundMessage(text, false);
	}

	public static InboundMessage envelope(String text) {
		return new InboundMessage(text, true);
	}

	public boolean isBlank() {
		return text.isBlank();
	}
}
