package com.study.webflux.agent.application.gateway.handler;

import java.util.List;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.agent.domain.dialogue.model.AgentResponse;
import com.study.webflux.agent.domain.gateway.exception.ProtocolException;
import com.study.webflux.agent.domain.gateway.model.InboundMessage;
import com.study.webflux.agent.domain.gateway.model.ServerMessage;

/**
 * 게이트웨이 텍스트 프레임을 해석하고 응답을 직렬화합니다. JSON으로 들어온 요청에는 JSON으로, 일반 텍스트 요청에는 텍스트로
 * 응답합니다.
 */
@Component
public class GatewayMessageCodec {

	private static final List<String> PAYLOAD_FIELDS = List.of("payload", "text", "message");

	private final ObjectMapper objectMapper;

	public GatewayMessageCodec(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public InboundMessage decode(String raw) {
		String trimmed = raw == null ? "" : raw.trim();
		if (!trimmed.startsWith("{")) {
			return InboundMessage.plain(trimmed);
		}
		JsonNode node;
		try {
			node = objectMapper.readTree(trimmed);
		} catch (JsonProcessingException e) {
			throw ProtocolException.malformed("Invalid JSON message: " + e.getOriginalMessage());
		}
		if (node == null || !node.isObject()) {
			throw ProtocolException.malformed("JSON message must be an object");
		}
		for (String field : PAYLOAD_FIELDS) {
			JsonNode value = node.get(field);
			if (value != null && value.isTextual() && !value.asText().isBlank()) {
				return InboundMessage.envelope(value.asText().trim());
			}
		}
		throw ProtocolException.malformed(
			"JSON message requires a non-blank 'payload', 'text' or 'message' field");
	}

	public String encodeResponse(AgentResponse response, InboundMessage inbound) {
		if (!inbound.json()) {
			return response.text();
		}
		return write(ServerMessage.response(response.text(), response.source().label()));
	}

	public String encodeFailure(String message, InboundMessage inbound) {
		return inbound.json() ? encodeError(message) : message;
	}

	public String encodeError(String message) {
		return write(ServerMessage.error(message));
	}

	private String write(ServerMessage message) {
		try {
			return objectMapper.writeValueAsString(message);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize server message", e);
		}
	}
}
