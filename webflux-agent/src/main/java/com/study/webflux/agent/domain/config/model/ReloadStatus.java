package com.study.webflux.agent.domain.config.model;

public enum ReloadStatus {
	RELOADED,
	UNCHANGED,
	DISABLED,
	FAILED
}
