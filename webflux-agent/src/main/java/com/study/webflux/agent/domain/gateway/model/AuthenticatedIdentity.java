package com.study.webflux.agent.domain.gateway.model;

public record AuthenticatedIdentity(
	String principal,
	boolean authenticated
) {
	private static final AuthenticatedIdentity ANONYMOUS = new AuthenticatedIdentity("anonymous",
		false);

	public AuthenticatedIdentity {
		if (principal == null || principal.isBlank()) {
			throw new IllegalArgumentException("principal cannot be null or blank");
		}
	}

	public static AuthenticatedIdentity anonymous() {
		return ANONYMOUS;
	}

	public static AuthenticatedIdentity sharedSecret() {
		return new AuthenticatedIdentity("shared-secret", true);
	}
}
