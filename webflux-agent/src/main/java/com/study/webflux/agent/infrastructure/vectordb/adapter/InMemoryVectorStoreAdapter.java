package com.study.webflux.agent.infrastructure.vectordb.adapter;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.study.webflux.agent.domain.vector.model.ScoredPoint;
import com.study.webflux.agent.domain.vector.model.VectorPoint;
import com.study.webflux.agent.domain.vector.port.VectorStorePort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 프로세스 메모리에 보관하는 벡터 저장소입니다. 코사인 유사도로 정렬하며 로컬 실행과 테스트에 사용합니다.
 */
public class InMemoryVectorStoreAdapter implements VectorStorePort {

	private final Map<String, Map<String, VectorPoint>> collections = new ConcurrentHashMap<>();

	@Override
	public Mono<Void> upsert(String collection, VectorPoint point) {
		return Mono.fromRunnable(() -> collections
			.computeIfAbsent(collection, name -> new ConcurrentHashMap<>())
			.put(point.id(), point));
	}

	@Override
	public Flux<ScoredPoint> search(String collection, List<Float> vector, int limit) {
		return Flux.defer(() -> {
			Map<String, VectorPoint> points = collections.getOrDefault(collection, Map.of());
			List<ScoredPoint> ranked = points.values().stream()
				.filter(point -> point.vector().size() == vector.size())
				.map(point -> new ScoredPoint(point.id(), cosine(vector, point.vector()),
					point.payload()))
				.sorted(Comparator.comparingDouble(ScoredPoint::score).reversed())
				.limit(limit)
				.toList();
			return Flux.fromIterable(ranked);
		});
	}

	static double cosine(List<Float> left, List<Float> right) {
		double dot = 0.0;
		double leftNorm = 0.0;
		double rightNorm = 0.0;
		for (int i = 0; i < left.size(); i++) {
			double a = left.get(i);
			double b = right.get(i);
			dot += a * b;
			leftNorm += a * a;
			rightNorm += b * b;
		}
		if (leftNorm == 0.0 || rightNorm == 0.0) {
			return 0.0;
		}
		return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
	}
}
