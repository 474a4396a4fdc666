package com.study.webflux.agent.domain.config.model;

public record RemoteConfigFetch(
	String content,
	String etag,
	boolean notModified
) {
	public static RemoteConfigFetch of(String content, String etag) {
		if (content == null || content.isBlank()) {
			throw new IllegalArgumentException("remote config content cannot be null or blank");
		}
		return new RemoteConfigFetch(content, etag, false);
	}

	public static RemoteConfigFetch unchanged(String etag) {
		return new RemoteConfigFetch(null, etag, true);
	}
}
