package com.study.webflux.agent.domain.gateway.exception;

/**
 * 핸드셰이크 인증 실패입니다. 해당 연결에만 치명적입니다.
 */
public class AuthException extends RuntimeException {

	public enum Reason {
		MISSING,
		EXPIRED,
		INVALID_SIGNATURE
	}

	private final Reason reason;

	public AuthException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public Reason getReason() {
		return reason;
	}
}
