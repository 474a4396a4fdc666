package com.study.webflux.agent.domain.cache.model;

/**
 * 캐시 조회 결과입니다. EXACT, SEMANTIC, MISS 중 하나입니다.
 */
public record CacheOutcome(
	CacheHitType type,
	String response,
	Double score
) {
	private static final CacheOutcome MISS = new CacheOutcome(CacheHitType.MISS, null, null);

	public CacheOutcome {
		if (type == null) {
			throw new IllegalArgumentException("type cannot be null");
		}
		if (type != CacheHitType.MISS && response == null) {
			throw new IllegalArgumentException("response cannot be null for a cache hit");
		}
		if (type == CacheHitType.SEMANTIC && score == null) {
			throw new IllegalArgumentException("score cannot be null for a semantic hit");
		}
	}

	public static CacheOutcome exactHit(String response) {
		return new CacheOutcome(CacheHitType.EXACT, response, null);
	}

	public static CacheOutcome semanticHit(String response, double score) {
		return new CacheOutcome(CacheHitType.SEMANTIC, response, score);
	}

	public static CacheOutcome miss() {
		return MISS;
	}

	public boolean isHit() {
		return type != CacheHitType.MISS;
	}
}
