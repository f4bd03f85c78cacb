package org.javai.planexec.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AgentConfigTest {

	@Test
	void defaultsCoverBothLanguages() {
		AgentConfig config = AgentConfig.defaults();

		assertThat(config.maxTotalSteps()).isEqualTo(30);
		assertThat(config.failureMarkers()).contains("未找到A股代码", "ticker not found");
		assertThat(config.freeTextArguments()).containsExactly("user_requirement", "report_content", "query");
		assertThat(config.reportDirectory()).isNull();
	}

	@Test
	void toBuilderChangesOnlyWhatIsSet() {
		AgentConfig base = AgentConfig.defaults();

		AgentConfig changed = base.toBuilder().maxConsecutiveRegenerations(1).build();

		assertThat(changed.maxConsecutiveRegenerations()).isEqualTo(1);
		assertThat(changed.maxTotalSteps()).isEqualTo(base.maxTotalSteps());
		assertThat(changed.argumentAliases()).isEqualTo(base.argumentAliases());
		assertThat(changed.oracle()).isEqualTo(base.oracle());
	}

	@Test
	void addedAliasesOverrideExistingOnes() {
		AgentConfig config = AgentConfig.builder()
				.argumentAliases(Map.of("代码", "code"))
				.addArgumentAliases(Map.of("代码", "stock_code", "类型", "data_type"))
				.build();

		assertThat(config.argumentAliases())
				.containsOnly(Map.entry("代码", "stock_code"), Map.entry("类型", "data_type"));
	}

	@Test
	void rejectsOutOfRangeLimits() {
		assertThatThrownBy(() -> AgentConfig.builder().maxTotalSteps(0).build())
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> AgentConfig.builder().memoryCapacity(0).build())
				.isInstanceOf(IllegalArgumentException.class);
	}
}
