package com.study.webflux.agent.fixture;

import com.study.webflux.agent.infrastructure.agent.config.properties.AgentProperties;

public final class AgentPropertiesFixture {

	private AgentPropertiesFixture() {
	}

	/** 기본값 그대로의 설정입니다. */
	public static AgentProperties create() {
		return new AgentProperties();
	}

	public static AgentProperties inMemory() {
		AgentProperties properties = new AgentProperties();
		properties.getCache().setKeyValueBackend(AgentProperties.KeyValueBackend.MEMORY);
		properties.getCache().setVectorBackend(AgentProperties.VectorBackend.MEMORY);
		properties.getRetrieval().setBackend(AgentProperties.VectorBackend.MEMORY);
		properties.getHistory().setBackend(AgentProperties.HistoryBackend.MEMORY);
		return properties;
	}

	public static AgentProperties withSecret(String secret) {
		AgentProperties properties = new AgentProperties();
		properties.getGateway().getAuth().setSecret(secret);
		return properties;
	}
}
