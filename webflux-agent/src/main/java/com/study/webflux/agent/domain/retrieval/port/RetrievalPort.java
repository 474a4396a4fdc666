package com.study.webflux.agent.domain.retrieval.port;

import com.study.webflux.agent.domain.dialogue.model.Embedding;
import com.study.webflux.agent.domain.retrieval.model.RetrievalContext;
import reactor.core.publisher.Mono;

/**
 * 인덱스 단위 유사도 검색을 제공하는 도메인 포트입니다.
 */
public interface RetrievalPort {

	/**
	 * 인덱스에서 질의 임베딩과 가까운 상위 문서를 검색합니다.
	 *
	 * @param index
	 *            검색할 인덱스
	 * @param embedding
	 *            질의 임베딩
	 * @param limit
	 *            검색할 최대 문서 수
	 * @return 검색 결과 컨텍스트
	 */
	Mono<RetrievalContext> retrieve(String index, Embedding embedding, int limit);
}
