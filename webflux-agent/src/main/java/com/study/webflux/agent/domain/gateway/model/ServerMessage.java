package com.study.webflux.agent.domain.gateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerMessage(
	String type,
	String content,
	String source,
	String message,
	long timestamp
) {
	public static final String TYPE_RESPONSE = "response";
	public static final String TYPE_ERROR = "error";

	public static ServerMessage response(String content, String source) {
		return new ServerMessage(TYPE_RESPONSE, content, source, null, System.currentTimeMillis());
	}

	public static ServerMessage error(String message) {
		return new ServerMessage(TYPE_ERROR, null, null, message, System.currentTimeMillis());
	}
}
