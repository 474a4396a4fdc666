package com.study.webflux.agent.infrastructure.vectordb.config;

import java.time.Duration;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import reactor.core.publisher.Mono;

/**
 * 시맨틱 캐시용 Qdrant 컬렉션이 없으면 생성합니다. 검색 인덱스 컬렉션은 외부에서 관리하므로 건드리지 않습니다.
 */
@Slf4j
public class QdrantCollectionInitializer implements ApplicationRunner {

	private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

	private final AgentProperties properties;
	private final WebClient webClient;

	public QdrantCollectionInitializer(AgentProperties properties,
		WebClient.Builder webClientBuilder) {
		this.properties = properties;
		var qdrant = properties.getQdrant();
		WebClient.Builder builder = webClientBuilder.baseUrl(trimTrailingSlash(qdrant.getUrl()));
		if (StringUtils.hasText(qdrant.getApiKey())) {
			builder.defaultHeader("api-key", qdrant.getApiKey());
		}
		this.webClient = builder.build();
	}

	@Override
	public void run(ApplicationArguments args) {
		String collection = properties.getCache().getCollection();
		if (!properties.getQdrant().isAutoCreateCacheCollection()) {
			log.info("캐시 컬렉션 자동 생성이 비활성화되어 초기화를 건너뜁니다. collection={}", collection);
			return;
		}
		try {
			if (collectionExists(collection)) {
				log.info("캐시 컬렉션이 이미 존재합니다. collection={}", collection);
				return;
			}
			createCollection(collection, properties.getQdrant().getVectorDimension());
		} catch (RuntimeException e) {
			log.warn("캐시 컬렉션을 준비하지 못했습니다. 시맨틱 캐시는 미스로 동작합니다. collection={}, 이유={}",
				collection, e.getMessage());
		}
	}

	boolean collectionExists(String collectionName) {
		return webClient.get()
			.uri("/collections/{collectionName}", collectionName)
			.exchangeToMono(response -> {
				HttpStatusCode status = response.statusCode();
				if (status.is2xxSuccessful()) {
					return response.releaseBody().thenReturn(true);
				}
				if (status.value() == 404) {
					return response.releaseBody().thenReturn(false);
				}
				return response.bodyToMono(String.class)
					.defaultIfEmpty("")
					.flatMap(body -> Mono.error(new IllegalStateException(
						"Qdrant 컬렉션 조회 실패 status=" + status.value() + " body=" + body)));
			})
			.blockOptional(REQUEST_TIMEOUT)
			.orElse(false);
	}

	void createCollection(String collectionName, int vectorDimension) {
		Map<String, Object> payload = Map.of("vectors",
			Map.of("size", vectorDimension, "distance", "Cosine"));

		webClient.put()
			.uri("/collections/{collectionName}", collectionName)
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(payload)
			.exchangeToMono(response -> {
				HttpStatusCode status = response.statusCode();
				if (status.is2xxSuccessful() || status.value() == 409) {
					return response.releaseBody();
				}
				return response.bodyToMono(String.class)
					.defaultIfEmpty("")
					.flatMap(body -> Mono.<Void>error(new IllegalStateException(
						"Qdrant 컬렉션 생성 실패 status=" + status.value() + " body=" + body)));
			})
			.block(REQUEST_TIMEOUT);

		log.info("캐시 컬렉션을 준비했습니다. collection={}, vectorDimension={}", collectionName,
			vectorDimension);
	}

	private String trimTrailingSlash(String url) {
		if (!StringUtils.hasText(url)) {
			return "";
		}
		if (url.endsWith("/")) {
			return url.substring(0, url.length() - 1);
		}
		return url;
	}
}
