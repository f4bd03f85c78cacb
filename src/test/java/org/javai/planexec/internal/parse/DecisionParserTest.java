package org.javai.planexec.internal.parse;

import static org.assertj.core.api.Assertions.assertThat;
import org.javai.planexec.Decision;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DecisionParserTest {

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
			"1|CONTINUE",
			"2|FINALIZE",
			"3|REGENERATE",
			"'  2  '|FINALIZE",
			"**3**|REGENERATE",
			"'\"1\"'|CONTINUE",
			"3. Regenerate the plan|REGENERATE",
			"Option 2|FINALIZE",
			"选项：3|REGENERATE"
	})
	void readsLeadingDigit(String answer, Decision expected) {
		assertThat(DecisionParser.parse(answer)).contains(expected);
	}

	@Test
	void unrecognizedAnswersContinue() {
		assertThat(DecisionParser.parse("I think we should finalize")).isEmpty();
		assertThat(DecisionParser.parse("4")).isEmpty();
		assertThat(DecisionParser.parse("")).isEmpty();
		assertThat(DecisionParser.parse(null)).isEmpty();
		assertThat(DecisionParser.parse("maybe")).isEmpty();
	}
}
