package com.study.webflux.agent.domain.config.model;

import java.util.List;

/**
 * 소스별 리로드 결과와 리로드 이후 스냅샷 버전입니다.
 */
public record ReloadReport(
	List<SourceReloadResult> details,
	long snapshotVersion
) {
	public ReloadReport {
		details = details == null ? List.of() : List.copyOf(details);
	}

	public boolean success() {
		return !details.isEmpty() && details.stream().noneMatch(SourceReloadResult::isFailure);
	}

	public boolean partial() {
		return details.stream().anyMatch(SourceReloadResult::isFailure)
			&& details.stream().anyMatch(result -> !result.isFailure());
	}

	public String summary() {
		if (success()) {
			return "Configuration reload completed";
		}
		return partial() ? "Configuration partially reloaded" : "Configuration reload failed";
	}
}
