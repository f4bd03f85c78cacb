package org.javai.planexec.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.javai.planexec.ConsoleRunListener;
import org.javai.planexec.PlanExecuteAgent;
import org.javai.planexec.config.AgentConfig;
import org.javai.planexec.testsupport.ScriptedOracle;
import org.javai.planexec.tool.ToolId;
import org.javai.planexec.tool.ToolRegistry;
import org.junit.jupiter.api.Test;

class PlanExecuteConsoleTest {

	private static final String ONE_STEP_PLAN = """
			[{"step": 1, "description": "Work it out", "action": "Add the numbers", "tool": null, "tool_args": null}]""";

	@Test
	void parsesConfigOptionAndUtterance() {
		PlanExecuteConsole.Arguments arguments = PlanExecuteConsole.Arguments.parse(
				new String[] {"--config", "conf/agent.yml", "What", "is", "NVDA", "at?"});

		assertThat(arguments.configPath()).isEqualTo(Path.of("conf/agent.yml"));
		assertThat(arguments.utterance()).isEqualTo("What is NVDA at?");
	}

	@Test
	void noArgumentsMeansInteractive() {
		PlanExecuteConsole.Arguments arguments = PlanExecuteConsole.Arguments.parse(new String[0]);

		assertThat(arguments.configPath()).isNull();
		assertThat(arguments.utterance()).isBlank();
	}

	@Test
	void configOptionNeedsAPath() {
		assertThatThrownBy(() -> PlanExecuteConsole.Arguments.parse(new String[] {"hello", "--config"}))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("--config requires a path");
	}

	@Test
	void interactiveRunsEachLineUntilExit() {
		ScriptedOracle oracle = ScriptedOracle.of(ONE_STEP_PLAN, "4", "1", "2 + 2 = 4");
		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
		PlanExecuteAgent agent = PlanExecuteAgent.builder()
				.oracle(oracle)
				.toolInvoker(new ToolRegistry())
				.listener(new ConsoleRunListener(out))
				.build();
		PlanExecuteConsole console = new PlanExecuteConsole(agent, out);

		int runs = console.interactive(input("What is 2+2?\n\n  \nexit\nnever run\n"));

		assertThat(runs).isEqualTo(1);
		assertThat(oracle.remaining()).isZero();
		assertThat(agent.memory().size()).isEqualTo(2);
		assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("2 + 2 = 4");
	}

	@Test
	void interactiveStopsAtEndOfInput() {
		ScriptedOracle oracle = ScriptedOracle.of();
		PlanExecuteAgent agent = PlanExecuteAgent.builder()
				.oracle(oracle)
				.toolInvoker(new ToolRegistry())
				.build();
		PlanExecuteConsole console = new PlanExecuteConsole(agent, new PrintStream(new ByteArrayOutputStream()));

		assertThat(console.interactive(input(""))).isZero();
		assertThat(oracle.calls()).isZero();
	}

	@Test
	void registryBindsBuiltinTools() {
		ToolRegistry registry = PlanExecuteConsole.createRegistry(AgentConfig.defaults());

		assertThat(registry.registeredTools())
				.containsExactlyInAnyOrder(ToolId.ADD, ToolId.CURRENT_TIME, ToolId.MARKDOWN_REPORT);
	}

	private static ByteArrayInputStream input(String text) {
		return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
	}
}
