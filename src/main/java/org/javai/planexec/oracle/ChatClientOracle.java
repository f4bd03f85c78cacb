package org.javai.planexec.oracle;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link Oracle} backed by a Spring AI {@link ChatClient}. Each prompt is sent as a single
 * user message.
 */
public final class ChatClientOracle implements Oracle {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientOracle.class);

	private final ChatClient chatClient;

	public ChatClientOracle(ChatClient chatClient) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
	}

	@Override
	public String generate(String prompt) {
		Objects.requireNonNull(prompt, "prompt must not be null");
		logger.debug("Prompt:\n{}", prompt);
		long start = System.nanoTime();
		String content;
		try {
			content = chatClient.prompt()
					.user(prompt)
					.call()
					.content();
		} catch (RuntimeException ex) {
			throw new OracleException("Chat model call failed: " + ex.getMessage(), ex);
		}
		if (content == null) {
			throw new OracleException("Chat model returned no content");
		}
		long durationMs = (System.nanoTime() - start) / 1_000_000;
		logger.debug("LLM response ({} ms):\n{}", durationMs, content);
		return content;
	}
}
