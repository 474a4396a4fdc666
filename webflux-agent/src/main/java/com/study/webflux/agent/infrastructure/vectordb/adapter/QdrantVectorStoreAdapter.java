package com.study.webflux.agent.infrastructure.vectordb.adapter;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.agent.domain.vector.model.ScoredPoint;
import com.study.webflux.agent.domain.vector.model.VectorPoint;
import com.study.webflux.agent.domain.vector.port.VectorStorePort;
import com.study.webflux.agent.infrastructure.vectordb.adapter.dto.QdrantPoint;
import com.study.webflux.agent.infrastructure.vectordb.adapter.dto.QdrantScoredPoint;
import com.study.webflux.agent.infrastructure.vectordb.adapter.dto.QdrantSearchRequest;
import com.study.webflux.agent.infrastructure.vectordb.adapter.dto.QdrantSearchResponse;
import com.study.webflux.agent.infrastructure.vectordb.adapter.dto.QdrantUpsertRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Qdrant REST API 어댑터입니다. 컬렉션 이름을 호출마다 받아 캐시 컬렉션과 검색 인덱스에 함께 사용합니다.
 */
@Slf4j
public class QdrantVectorStoreAdapter implements VectorStorePort {

	private final WebClient webClient;

	public QdrantVectorStoreAdapter(WebClient.Builder webClientBuilder, String url, String apiKey) {
		WebClient.Builder builder = webClientBuilder
			.baseUrl(url)
			.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);

		if (StringUtils.hasText(apiKey)) {
			builder.defaultHeader("api-key", apiKey);
		}

		this.webClient = builder.build();
	}

	@Override
	public Mono<Void> upsert(String collection, VectorPoint point) {
		QdrantUpsertRequest request = new QdrantUpsertRequest(
			List.of(new QdrantPoint(point.id(), point.vector(), point.payload())));

		return webClient.put()
			.uri("/collections/{collection}/points?wait=true", collection)
			.bodyValue(request)
			.retrieve()
			.toBodilessEntity()
			.doOnNext(response -> log.debug("Qdrant 포인트 저장 collection={}, id={}", collection,
				point.id()))
			.then();
	}

	@Override
	public Flux<ScoredPoint> search(String collection, List<Float> vector, int limit) {
		QdrantSearchRequest request = new QdrantSearchRequest(vector, limit, true);

		return webClient.post()
			.uri("/collections/{collection}/points/search", collection)
			.bodyValue(request)
			.retrieve()
			.bodyToMono(QdrantSearchResponse.class)
			.flatMapMany(response -> response.result() == null
				? Flux.empty()
				: Flux.fromIterable(response.result()))
			.map(this::toScoredPoint);
	}

	private ScoredPoint toScoredPoint(QdrantScoredPoint point) {
		if (point.id() == null) {
			throw new IllegalStateException("잘못된 Qdrant 응답: 포인트 id 누락");
		}
		return new ScoredPoint(String.valueOf(point.id()), point.score(), point.payload());
	}
}
