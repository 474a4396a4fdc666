package com.study.webflux.agent.application.admin.dto;

import java.util.List;

import com.study.webflux.agent.domain.config.model.ReloadReport;
import com.study.webflux.agent.domain.config.model.SourceReloadResult;

public record ReloadResponse(
	boolean success,
	String message,
	List<String> details,
	long version
) {
	public static ReloadResponse from(ReloadReport report) {
		return new ReloadResponse(report.success(), report.summary(),
			report.details().stream().map(SourceReloadResult::describe).toList(),
			report.snapshotVersion());
	}

	public static ReloadResponse rejected(String message) {
		return new ReloadResponse(false, message, List.of(), -1);
	}
}
