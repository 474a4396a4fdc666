package com.study.webflux.agent.domain.dialogue.exception;

/**
 * 생성 백엔드 호출이 실패했을 때 발생합니다. 해당 요청에만 치명적이며 연결은 유지됩니다.
 */
public class GenerationException extends RuntimeException {

	public enum Reason {
		PROVIDER_FAILURE,
		TIMEOUT,
		INVALID_RESPONSE
	}

	private final Reason reason;

	public GenerationException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public GenerationException(Reason reason, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason;
	}

	public Reason getReason() {
		return reason;
	}
}
