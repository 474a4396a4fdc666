package com.study.webflux.agent.domain.vector.port;

import java.util.List;

import com.study.webflux.agent.domain.vector.model.ScoredPoint;
import com.study.webflux.agent.domain.vector.model.VectorPoint;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 벡터 유사도 백엔드입니다. 시맨틱 캐시와 문서 검색이 함께 사용합니다.
 */
public interface VectorStorePort {

	Mono<Void> upsert(String collection, VectorPoint point);

	/**
	 * 컬렉션에서 주어진 벡터와 가장 가까운 포인트를 유사도 내림차순으로 반환합니다.
	 *
	 * @param collection
	 *            검색 대상 컬렉션
	 * @param vector
	 *            질의 벡터
	 * @param limit
	 *            최대 결과 수
	 * @return 코사인 유사도 점수가 포함된 포인트
	 */
	Flux<ScoredPoint> search(String collection, List<Float> vector, int limit);
}
