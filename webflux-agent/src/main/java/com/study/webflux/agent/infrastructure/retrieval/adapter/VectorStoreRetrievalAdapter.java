package com.study.webflux.agent.infrastructure.retrieval.adapter;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.study.webflux.agent.domain.dialogue.model.Embedding;
import com.study.webflux.agent.domain.retrieval.model.RetrievalContext;
import com.study.webflux.agent.domain.retrieval.model.RetrievalDocument;
import com.study.webflux.agent.domain.retrieval.port.RetrievalPort;
import com.study.webflux.agent.domain.vector.port.VectorStorePort;
import reactor.core.publisher.Mono;

/**
 * 인덱스 이름과 같은 벡터 컬렉션에서 유사 문서를 검색합니다. 포인트 페이로드가 문서 필드가 됩니다.
 */
@Component
public class VectorStoreRetrievalAdapter implements RetrievalPort {

	private final VectorStorePort vectorStore;

	public VectorStoreRetrievalAdapter(@Qualifier("retrievalVectorStore") VectorStorePort vectorStore) {
		this.vectorStore = vectorStore;
	}

	@Override
	public Mono<RetrievalContext> retrieve(String index, Embedding embedding, int limit) {
		return vectorStore.search(index, embedding.vector(), limit)
			.map(point -> new RetrievalDocument(point.id(), point.score(), point.payload()))
			.collectList()
			.map(documents -> RetrievalContext.of(index, documents));
	}
}
