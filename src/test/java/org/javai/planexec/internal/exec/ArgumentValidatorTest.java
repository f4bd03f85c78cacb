package org.javai.planexec.internal.exec;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.planexec.config.AgentConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ArgumentValidatorTest {

	private final ArgumentValidator validator = new ArgumentValidator(AgentConfig.defaults());

	@ParameterizedTest
	@ValueSource(strings = {"", "   ", "none", "None", "NONE"})
	void rejectsEmptyValues(String value) {
		ValidationResult result = validator.validate(Map.of("stock_code", value));

		assertThat(result.valid()).isFalse();
		assertThat(result.argument()).isEqualTo("stock_code");
		assertThat(result.message()).startsWith("Argument validation failed").contains("is empty");
	}

	@Test
	void rejectsNullValues() {
		Map<String, Object> args = new HashMap<>();
		args.put("stock_code", null);

		assertThat(validator.validate(args).valid()).isFalse();
	}

	@ParameterizedTest
	@ValueSource(strings = {"从步骤1的结果中提取股票代码", "codes extracted in step 1", "the result of step 2"})
	void rejectsDescriptiveText(String value) {
		ValidationResult result = validator.validate(Map.of("stock_code", value));

		assertThat(result.valid()).isFalse();
		assertThat(result.message()).contains("reads as a description");
	}

	@Test
	void shortValuesWithKeywordsPass() {
		// length 4 does not exceed the threshold
		assertThat(validator.validate(Map.of("stock_code", "step")).valid()).isTrue();
		assertThat(validator.validate(Map.of("stock_code", "分析")).valid()).isTrue();
	}

	@Test
	void freeTextArgumentsAreNotChecked() {
		Map<String, Object> args = new LinkedHashMap<>();
		args.put("user_requirement", "根据步骤1的执行结果生成报告");
		args.put("report_content", "");
		args.put("query", "none");

		assertThat(validator.validate(args).valid()).isTrue();
	}

	@Test
	void concreteValuesPass() {
		Map<String, Object> args = new LinkedHashMap<>();
		args.put("stock_code", "NVDA, AMD, 600519");
		args.put("data_type", "history");
		args.put("n_results", 5);
		args.put("filters", Map.of("ticker", "NVDA"));

		assertThat(validator.validate(args)).isEqualTo(ValidationResult.ok());
	}

	@Test
	void reportsFirstRejectedArgument() {
		Map<String, Object> args = new LinkedHashMap<>();
		args.put("stock_code", "NVDA");
		args.put("start_date", "none");
		args.put("end_date", "");

		assertThat(validator.validate(args).argument()).isEqualTo("start_date");
	}
}
