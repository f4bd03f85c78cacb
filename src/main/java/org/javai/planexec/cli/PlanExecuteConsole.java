package org.javai.planexec.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.javai.planexec.ConsoleRunListener;
import org.javai.planexec.PlanExecuteAgent;
import org.javai.planexec.config.AgentConfig;
import org.javai.planexec.config.AgentConfigLoader;
import org.javai.planexec.config.OracleSettings;
import org.javai.planexec.oracle.ChatClientOracle;
import org.javai.planexec.oracle.Oracle;
import org.javai.planexec.tool.ToolRegistry;
import org.javai.planexec.tool.builtin.ArithmeticTools;
import org.javai.planexec.tool.builtin.ClockTools;
import org.javai.planexec.tool.builtin.MarkdownReportTools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;

/**
 * Operator console for the agent.
 *
 * <pre>
 * PlanExecuteConsole [--config planexec.yml] [utterance...]
 * </pre>
 *
 * <p>With an utterance on the command line, runs it once. Otherwise reads one utterance per
 * line from stdin until end of input or {@code exit}.</p>
 */
public final class PlanExecuteConsole {

	private static final Logger logger = LoggerFactory.getLogger(PlanExecuteConsole.class);

	static final String EXIT_COMMAND = "exit";

	private final PlanExecuteAgent agent;
	private final PrintStream out;

	PlanExecuteConsole(PlanExecuteAgent agent, PrintStream out) {
		this.agent = agent;
		this.out = out;
	}

	public static void main(String[] args) {
		Arguments arguments = Arguments.parse(args);
		AgentConfigLoader loader = new AgentConfigLoader();
		AgentConfig config = arguments.configPath() != null
				? loader.load(arguments.configPath())
				: loader.loadDefault();

		PlanExecuteAgent agent = PlanExecuteAgent.builder()
				.oracle(createOracle(config.oracle()))
				.toolInvoker(createRegistry(config))
				.config(config)
				.listener(new ConsoleRunListener(System.out))
				.build();

		PlanExecuteConsole console = new PlanExecuteConsole(agent, System.out);
		if (arguments.utterance().isBlank()) {
			console.interactive(System.in);
		} else {
			console.runOnce(arguments.utterance());
		}
	}

	void runOnce(String utterance) {
		agent.run(utterance);
	}

	/**
	 * Runs each non-blank line as a request until end of input or {@value #EXIT_COMMAND}.
	 *
	 * @return the number of requests run
	 */
	int interactive(InputStream in) {
		int runs = 0;
		BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		try {
			while (true) {
				out.print("\n> ");
				out.flush();
				String line = reader.readLine();
				if (line == null || line.trim().equalsIgnoreCase(EXIT_COMMAND)) {
					break;
				}
				if (line.isBlank()) {
					continue;
				}
				agent.run(line.trim());
				runs++;
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read from console", e);
		}
		return runs;
	}

	static Oracle createOracle(OracleSettings settings) {
		String apiKey = settings.apiKey() != null && !settings.apiKey().isBlank() ? settings.apiKey() : "none";
		OpenAiApi openAiApi = OpenAiApi.builder()
				.baseUrl(settings.baseUrl())
				.apiKey(apiKey)
				.build();
		OpenAiChatModel chatModel = OpenAiChatModel.builder()
				.openAiApi(openAiApi)
				.build();
		OpenAiChatOptions options = OpenAiChatOptions.builder()
				.model(settings.model())
				.temperature(settings.temperature())
				.build();
		ChatClient client = ChatClient.builder(chatModel)
				.defaultOptions(options)
				.build();
		logger.info("Using model {} at {}", settings.model(), settings.baseUrl());
		return new ChatClientOracle(client);
	}

	static ToolRegistry createRegistry(AgentConfig config) {
		Clock clock = Clock.systemDefaultZone();
		return new ToolRegistry()
				.registerTools(new ArithmeticTools())
				.registerTools(new ClockTools(clock))
				.registerTools(new MarkdownReportTools(clock, config.reportDirectory()));
	}

	record Arguments(Path configPath, String utterance) {

		static Arguments parse(String[] args) {
			Path configPath = null;
			List<String> words = new ArrayList<>();
			for (int i = 0; i < args.length; i++) {
				if (args[i].equals("--config")) {
					if (i + 1 >= args.length) {
						throw new IllegalArgumentException("--config requires a path");
					}
					configPath = Path.of(args[++i]);
				} else {
					words.add(args[i]);
				}
			}
			return new Arguments(configPath, String.join(" ", words));
		}
	}
}
