package com.study.webflux.agent.infrastructure.config.adapter;

import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.agent.domain.config.exception.ConfigException;
import com.study.webflux.agent.domain.config.model.RemoteConfigFetch;
import com.study.webflux.agent.domain.config.port.RemoteConfigPort;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import reactor.core.publisher.Mono;

/**
 * 원격 설정 서버에서 프롬프트 문서를 가져옵니다.
 *
 * <p>
 * 응답 JSON에서 valuePointer 위치의 값을 프롬프트 문서로 사용합니다. 값이 문자열이면 그 안의 JSON을, 객체이면 객체
 * 자체를 사용합니다. 이전 ETag를 If-None-Match로 보내 304 응답이면 변경 없음으로 처리합니다.
 */
@Slf4j
@Component
public class RemoteConfigHttpAdapter implements RemoteConfigPort {

	private final WebClient webClient;
	private final ObjectMapper objectMapper;
	private final boolean enabled;
	private final JsonPointer valuePointer;

	public RemoteConfigHttpAdapter(WebClient.Builder webClientBuilder,
		ObjectMapper objectMapper,
		AgentProperties properties) {
		var remote = properties.getConfig().getRemote();
		this.objectMapper = objectMapper;
		this.enabled = remote.isEnabled() && StringUtils.hasText(remote.getUrl());
		this.valuePointer = JsonPointer.compile(remote.getValuePointer());

		WebClient.Builder builder = webClientBuilder.clone()
			.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
		if (StringUtils.hasText(remote.getUrl())) {
			builder.baseUrl(remote.getUrl());
		}
		if (StringUtils.hasText(remote.getAccessToken())) {
			builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + remote.getAccessToken());
		}
		this.webClient = builder.build();
		if (remote.isEnabled() && !enabled) {
			log.warn("원격 설정이 활성화되었지만 URL이 없어 비활성화합니다");
		}
	}

	@Override
	public boolean isEnabled() {
		return enabled;
	}

	@Override
	public Mono<RemoteConfigFetch> fetchPrompts(String knownEtag) {
		return webClient.get()
			.uri("")
			.headers(headers -> {
				if (StringUtils.hasText(knownEtag)) {
					headers.setIfNoneMatch(knownEtag);
				}
			})
			.exchangeToMono(response -> handleResponse(response, knownEtag));
	}

	private Mono<RemoteConfigFetch> handleResponse(ClientResponse response, String knownEtag) {
		if (response.statusCode().value() == HttpStatus.NOT_MODIFIED.value()) {
			return response.releaseBody().thenReturn(RemoteConfigFetch.unchanged(knownEtag));
		}
		if (!response.statusCode().is2xxSuccessful()) {
			int status = response.statusCode().value();
			return response.bodyToMono(String.class)
				.defaultIfEmpty("")
				.flatMap(body -> Mono.error(ConfigException.unavailable(
					"remote config responded with status " + status, null)));
		}
		String etag = response.headers().asHttpHeaders().getETag();
		return response.bodyToMono(String.class)
			.switchIfEmpty(Mono.error(ConfigException.invalid("remote config body is empty", null)))
			.map(body -> RemoteConfigFetch.of(extractPrompts(body), etag));
	}

	String extractPrompts(String body) {
		JsonNode root;
		try {
			root = objectMapper.readTree(body);
		} catch (JsonProcessingException e) {
			throw ConfigException.invalid("remote config is not valid JSON: " + e.getOriginalMessage(), e);
		}
		JsonNode value = root.at(valuePointer);
		if (value.isMissingNode() || value.isNull()) {
			throw ConfigException.invalid("remote config has no value at " + valuePointer, null);
		}
		if (value.isTextual()) {
			return value.asText();
		}
		if (value.isObject()) {
			return value.toString();
		}
		throw ConfigException.invalid("remote config value at " + valuePointer + " must be a string or object",
			null);
	}
}
