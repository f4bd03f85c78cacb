package org.javai.planexec.oracle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import org.apache.logging.log4j.Level;
import org.javai.planexec.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.ai.chat.client.ChatClient;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ChatClientOracleTest {

	@Mock
	private ChatClient chatClient;

	@Mock
	private ChatClient.ChatClientRequestSpec requestSpec;

	@Mock
	private ChatClient.CallResponseSpec callResponseSpec;

	private ChatClientOracle oracle;

	@BeforeEach
	void setUp() {
		when(chatClient.prompt()).thenReturn(requestSpec);
		when(requestSpec.user(anyString())).thenReturn(requestSpec);
		when(requestSpec.call()).thenReturn(callResponseSpec);
		oracle = new ChatClientOracle(chatClient);
	}

	@Test
	void sendsPromptAsSingleUserMessage() {
		when(callResponseSpec.content()).thenReturn("1");

		assertThat(oracle.generate("Decide what to do next")).isEqualTo("1");

		ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
		verify(requestSpec).user(userCaptor.capture());
		assertThat(userCaptor.getValue()).isEqualTo("Decide what to do next");
	}

	@Test
	void modelFailuresAreWrapped() {
		when(callResponseSpec.content()).thenThrow(new IllegalStateException("connection refused"));

		assertThatThrownBy(() -> oracle.generate("plan"))
				.isInstanceOf(OracleException.class)
				.hasMessage("Chat model call failed: connection refused")
				.hasCauseInstanceOf(IllegalStateException.class);
	}

	@Test
	void promptIsLoggedEvenWhenTheCallFails() {
		when(callResponseSpec.content()).thenThrow(new IllegalStateException("timeout"));

		try (LogCaptorAppender logs = LogCaptorAppender.capture(ChatClientOracle.class)) {
			assertThatThrownBy(() -> oracle.generate("Decide what to do next"))
					.isInstanceOf(OracleException.class);

			assertThat(logs.messagesAt(Level.DEBUG)).containsExactly("Prompt:\nDecide what to do next");
		}
	}

	@Test
	void missingContentIsAFailure() {
		when(callResponseSpec.content()).thenReturn(null);

		assertThatThrownBy(() -> oracle.generate("plan"))
				.isInstanceOf(OracleException.class)
				.hasMessage("Chat model returned no content");
	}
}
