package com.study.webflux.agent.domain.gateway.exception;

/**
 * 연결 프로토콜 위반입니다. 통지 후 연결을 종료합니다.
 */
public class ProtocolException extends RuntimeException {

	public enum Reason {
		OVERSIZED_MESSAGE,
		MALFORMED
	}

	private final Reason reason;

	public ProtocolException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public static ProtocolException oversized(int size, int limit) {
		return new ProtocolException(Reason.OVERSIZED_MESSAGE,
			"Message too large: " + size + " bytes exceeds limit of " + limit + " bytes");
	}

	public static ProtocolException malformed(String message) {
		return new ProtocolException(Reason.MALFORMED, message);
	}

	public Reason getReason() {
		return reason;
	}
}
