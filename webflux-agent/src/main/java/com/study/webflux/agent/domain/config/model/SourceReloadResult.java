package com.study.webflux.agent.domain.config.model;

import java.util.Locale;

public record SourceReloadResult(
	ConfigSource source,
	ReloadStatus status,
	String message
) {
	public SourceReloadResult {
		if (source == null || source == ConfigSource.BOTH) {
			throw new IllegalArgumentException("source must be local or remote");
		}
		if (status == null) {
			throw new IllegalArgumentException("status cannot be null");
		}
		message = message == null ? "" : message;
	}

	public static SourceReloadResult reloaded(ConfigSource source, String message) {
		return new SourceReloadResult(source, ReloadStatus.RELOADED, message);
	}

	public static SourceReloadResult unchanged(ConfigSource source, String message) {
		return new SourceReloadResult(source, ReloadStatus.UNCHANGED, message);
	}

	public static SourceReloadResult disabled(ConfigSource source, String message) {
		return new SourceReloadResult(source, ReloadStatus.DISABLED, message);
	}

	public static SourceReloadResult failed(ConfigSource source, String message) {
		return new SourceReloadResult(source, ReloadStatus.FAILED, message);
	}

	public boolean isFailure() {
		return status == ReloadStatus.FAILED;
	}

	public String describe() {
		return source.label() + ": " + status.name().toLowerCase(Locale.ROOT)
			+ (message.isBlank() ? "" : " - " + message);
	}
}
