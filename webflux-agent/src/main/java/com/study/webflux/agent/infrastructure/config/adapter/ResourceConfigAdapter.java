package com.study.webflux.agent.infrastructure.config.adapter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import com.study.webflux.agent.domain.config.exception.ConfigException;
import com.study.webflux.agent.domain.config.port.LocalConfigPort;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Spring Resource 위치(classpath:, file:)에서 로컬 설정 파일을 읽습니다.
 */
@Slf4j
@Component
public class ResourceConfigAdapter implements LocalConfigPort {

	private final ResourceLoader resourceLoader;
	private final String promptsLocation;
	private final String indexSchemaLocation;

	public ResourceConfigAdapter(ResourceLoader resourceLoader, AgentProperties properties) {
		this.resourceLoader = resourceLoader;
		this.promptsLocation = properties.getConfig().getPromptsLocation();
		this.indexSchemaLocation = properties.getConfig().getIndexSchemaLocation();
	}

	@Override
	public Mono<String> readPrompts() {
		return read(promptsLocation);
	}

	@Override
	public Mono<String> readIndexSchema() {
		return read(indexSchemaLocation);
	}

	/** 두 파일 중 파일 시스템 리소스가 없으면 비어 있는 Mono를 반환합니다. */
	@Override
	public Mono<Instant> lastModified() {
		return Mono.fromCallable(() -> {
			Instant latest = null;
			for (String location : List.of(promptsLocation, indexSchemaLocation)) {
				Resource resource = resourceLoader.getResource(location);
				if (!resource.isFile()) {
					continue;
				}
				Instant modified = Instant.ofEpochMilli(resource.lastModified());
				if (latest == null || modified.isAfter(latest)) {
					latest = modified;
				}
			}
			return latest;
		})
			.onErrorMap(IOException.class, e -> ConfigException.unavailable(
				"Cannot stat local configuration files", e))
			.subscribeOn(Schedulers.boundedElastic());
	}

	private Mono<String> read(String location) {
		return Mono.fromCallable(() -> {
			Resource resource = resourceLoader.getResource(location);
			if (!resource.exists()) {
				throw ConfigException.unavailable("Config file not found: " + location, null);
			}
			try (InputStream input = resource.getInputStream()) {
				String content = new String(input.readAllBytes(), StandardCharsets.UTF_8);
				log.debug("설정 파일을 읽었습니다 location={}, length={}", location, content.length());
				return content;
			}
		})
			.onErrorMap(IOException.class, e -> ConfigException.unavailable(
				"Cannot read config file " + location, e))
			.subscribeOn(Schedulers.boundedElastic());
	}
}
