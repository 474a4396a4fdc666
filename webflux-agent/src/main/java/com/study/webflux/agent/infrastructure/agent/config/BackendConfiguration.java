package com.study.webflux.agent.infrastructure.agent.config;

import java.time.Clock;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.agent.domain.vector.port.VectorStorePort;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;
import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties.VectorBackend;
import com.study.webflux.agent.infrastructure.vectordb.adapter.InMemoryVectorStoreAdapter;
import com.study.webflux.agent.infrastructure.vectordb.adapter.QdrantVectorStoreAdapter;
import com.study.webflux.agent.infrastructure.vectordb.config.QdrantCollectionInitializer;

/** 벡터 저장소 백엔드 선택과 공용 빈을 제공합니다. */
@Configuration
public class BackendConfiguration {

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public QdrantVectorStoreAdapter qdrantVectorStoreAdapter(WebClient.Builder webClientBuilder,
		AgentProperties properties) {
		var qdrant = properties.getQdrant();
		return new QdrantVectorStoreAdapter(webClientBuilder.clone(), qdrant.getUrl(), qdrant.getApiKey());
	}

	@Bean
	public InMemoryVectorStoreAdapter inMemoryVectorStoreAdapter() {
		return new InMemoryVectorStoreAdapter();
	}

	/** 시맨틱 캐시가 사용할 벡터 저장소입니다. */
	@Bean
	@Qualifier("cacheVectorStore")
	public VectorStorePort cacheVectorStore(AgentProperties properties,
		QdrantVectorStoreAdapter qdrantVectorStoreAdapter,
		InMemoryVectorStoreAdapter inMemoryVectorStoreAdapter) {
		return select(properties.getCache().getVectorBackend(), qdrantVectorStoreAdapter,
			inMemoryVectorStoreAdapter);
	}

	/** 문서 검색이 사용할 벡터 저장소입니다. */
	@Bean
	@Qualifier("retrievalVectorStore")
	public VectorStorePort retrievalVectorStore(AgentProperties properties,
		QdrantVectorStoreAdapter qdrantVectorStoreAdapter,
		InMemoryVectorStoreAdapter inMemoryVectorStoreAdapter) {
		return select(properties.getRetrieval().getBackend(), qdrantVectorStoreAdapter,
			inMemoryVectorStoreAdapter);
	}

	@Bean
	@ConditionalOnProperty(prefix = "agent.cache", name = "vector-backend", havingValue = "qdrant", matchIfMissing = true)
	public QdrantCollectionInitializer qdrantCollectionInitializer(AgentProperties properties,
		WebClient.Builder webClientBuilder) {
		return new QdrantCollectionInitializer(properties, webClientBuilder.clone());
	}

	private VectorStorePort select(VectorBackend backend,
		QdrantVectorStoreAdapter qdrant,
		InMemoryVectorStoreAdapter inMemory) {
		return backend == VectorBackend.MEMORY ? inMemory : qdrant;
	}
}
