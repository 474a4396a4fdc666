package com.study.webflux.agent.infrastructure.llm.adapter;

import java.util.List;

import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.stereotype.Component;

import com.study.webflux.agent.domain.dialogue.model.CompletionRequest;
import com.study.webflux.agent.domain.dialogue.model.Message;
import com.study.webflux.agent.domain.dialogue.port.LlmPort;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Spring AI ChatModel 기반 LLM 어댑터입니다. 블로킹 호출은 boundedElastic 스케줄러에서 실행합니다.
 */
@Component
public class SpringAiLlmAdapter implements LlmPort {

	private final ChatModel chatModel;

	public SpringAiLlmAdapter(ChatModel chatModel) {
		this.chatModel = chatModel;
	}

	@Override
	public Mono<String> complete(CompletionRequest request) {
		Prompt prompt = toPrompt(request);

		return Mono.fromCallable(() -> {
			ChatResponse response = chatModel.call(prompt);
			var result = response != null ? response.getResult() : null;
			if (result == null || result.getOutput() == null || result.getOutput().getText() == null) {
				throw new IllegalStateException("Invalid response from LLM");
			}
			return result.getOutput().getText();
		}).subscribeOn(Schedulers.boundedElastic());
	}

	private Prompt toPrompt(CompletionRequest request) {
		List<org.springframework.ai.chat.messages.Message> messages = request.messages().stream()
			.map(this::convertMessage)
			.toList();
		if (request.model() == null || request.model().isBlank()) {
			return new Prompt(messages);
		}
		return new Prompt(messages, OpenAiChatOptions.builder().model(request.model()).build());
	}

	private org.springframework.ai.chat.messages.Message convertMessage(Message message) {
		return switch (message.role()) {
			case SYSTEM -> new SystemMessage(message.content());
			case USER -> new UserMessage(message.content());
			case ASSISTANT -> new AssistantMessage(message.content());
		};
	}
}
