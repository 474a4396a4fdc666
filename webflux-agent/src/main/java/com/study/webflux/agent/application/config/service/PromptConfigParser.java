package com.study.webflux.agent.application.config.service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.agent.domain.config.exception.ConfigException;
import com.study.webflux.agent.domain.config.model.IndexDefinition;
import com.study.webflux.agent.domain.config.model.IndexSchema;
import com.study.webflux.agent.domain.config.model.IntentAction;
import com.study.webflux.agent.domain.config.model.IntentDefinition;
import com.study.webflux.agent.domain.config.model.PromptConfig;

/**
 * prompts.json과 index_schema.json 문서를 도메인 모델로 변환합니다. 형식 오류는 모두 INVALID로 보고합니다.
 */
@Component
public class PromptConfigParser {

	private final ObjectMapper objectMapper;

	public PromptConfigParser(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public PromptConfig parsePrompts(String json) {
		JsonNode root = readObject(json, "prompt configuration");

		Map<String, IntentDefinition> intents = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> fields = requireObject(root, "intents").fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> entry = fields.next();
			intents.put(entry.getKey(), parseIntent(entry.getKey(), entry.getValue()));
		}

		return new PromptConfig(intents,
			optionalTemplates(root, "core_prompts"),
			templates(requireObject(root, "query_templates"), "query_templates"),
			templates(requireObject(root, "response_templates"), "response_templates"));
	}

	public IndexSchema parseIndexSchema(String json) {
		JsonNode root = read(json, "index schema");
		JsonNode indexesNode = root.isArray() ? root : root.get("indexes");
		if (indexesNode == null || !indexesNode.isArray()) {
			throw ConfigException.invalid("index schema must contain an 'indexes' array", null);
		}

		List<IndexDefinition> indexes = new ArrayList<>();
		for (JsonNode node : indexesNode) {
			String name = text(node, "name");
			if (name == null || name.isBlank()) {
				throw ConfigException.invalid("index definition requires a non-blank 'name'", null);
			}
			indexes.add(new IndexDefinition(name.trim(), text(node, "description"),
				stringList(node, "fields", "index '" + name + "'")));
		}
		return new IndexSchema(indexes);
	}

	private IntentDefinition parseIntent(String name, JsonNode node) {
		if (!node.isObject()) {
			throw ConfigException.invalid("intent '" + name + "' must be an object", null);
		}
		IntentAction action;
		try {
			action = IntentAction.fromValue(text(node, "action"));
		} catch (IllegalArgumentException e) {
			throw ConfigException.invalid("intent '" + name + "': " + e.getMessage(), e);
		}
		List<String> patterns = stringList(node, "patterns", "intent '" + name + "'");
		for (String pattern : patterns) {
			try {
				Pattern.compile(pattern);
			} catch (PatternSyntaxException e) {
				throw ConfigException.invalid(
					"intent '" + name + "' has an invalid pattern: " + pattern, e);
			}
		}
		return new IntentDefinition(text(node, "description"),
			action,
			stringList(node, "keywords", "intent '" + name + "'"),
			patterns,
			text(node, "response_template"),
			text(node, "template"));
	}

	private Map<String, String> optionalTemplates(JsonNode root, String field) {
		JsonNode node = root.get(field);
		if (node == null || node.isNull()) {
			return Map.of();
		}
		if (!node.isObject()) {
			throw ConfigException.invalid("'" + field + "' must be an object", null);
		}
		return templates(node, field);
	}

	private Map<String, String> templates(JsonNode node, String field) {
		Map<String, String> templates = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
		while (entries.hasNext()) {
			Map.Entry<String, JsonNode> entry = entries.next();
			if (!entry.getValue().isTextual()) {
				throw ConfigException.invalid(
					"'" + field + "." + entry.getKey() + "' must be a string", null);
			}
			templates.put(entry.getKey(), entry.getValue().asText());
		}
		return templates;
	}

	private JsonNode readObject(String json, String label) {
		JsonNode root = read(json, label);
		if (!root.isObject()) {
			throw ConfigException.invalid(label + " must be a JSON object", null);
		}
		return root;
	}

	private JsonNode read(String json, String label) {
		if (json == null || json.isBlank()) {
			throw ConfigException.invalid(label + " is empty", null);
		}
		try {
			return objectMapper.readTree(json);
		} catch (JsonProcessingException e) {
			throw ConfigException.invalid(label + " is not valid JSON: " + e.getOriginalMessage(),
				e);
		}
	}

	private JsonNode requireObject(JsonNode root, String field) {
		JsonNode node = root.get(field);
		if (node == null || !node.isObject()) {
			throw ConfigException.invalid("'" + field + "' must be an object", null);
		}
		return node;
	}

	private String text(JsonNode node, String field) {
		JsonNode value = node.get(field);
		return value != null && value.isTextual() ? value.asText() : null;
	}

	private List<String> stringList(JsonNode node, String field, String owner) {
		JsonNode value = node.get(field);
		if (value == null || value.isNull()) {
			return List.of();
		}
		if (!value.isArray()) {
			throw ConfigException.invalid(owner + " '" + field + "' must be an array", null);
		}
		List<String> values = new ArrayList<>();
		for (JsonNode item : value) {
			if (!item.isTextual()) {
				throw ConfigException.invalid(owner + " '" + field + "' must contain strings", null);
			}
			values.add(item.asText());
		}
		return values;
	}
}
