package com.study.webflux.agent.domain.config.exception;

/**
 * 설정 소스를 읽거나 해석하지 못했을 때 발생합니다. 기존 스냅샷은 그대로 유지됩니다.
 */
public class ConfigException extends RuntimeException {

	public enum Reason {
		INVALID,
		SOURCE_UNAVAILABLE
	}

	private final Reason reason;

	public ConfigException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public ConfigException(Reason reason, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason;
	}

	public static ConfigException invalid(String message, Throwable cause) {
		return new ConfigException(Reason.INVALID, message, cause);
	}

	public static ConfigException unavailable(String message, Throwable cause) {
		return new ConfigException(Reason.SOURCE_UNAVAILABLE, message, cause);
	}

	public Reason getReason() {
		return reason;
	}
}
