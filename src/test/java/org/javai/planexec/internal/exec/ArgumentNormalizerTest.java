package org.javai.planexec.internal.exec;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ArgumentNormalizerTest {

	@Test
	void collapsesHistorySynonyms() {
		assertThat(ArgumentNormalizer.normalize("akshare_search", Map.of("stock_code", "NVDA", "data_type", "daily_history")))
				.containsEntry("data_type", "history")
				.containsEntry("stock_code", "NVDA");
		assertThat(ArgumentNormalizer.normalize("akshare_search", Map.of("data_type", "stock_history")))
				.containsEntry("data_type", "history");
	}

	@Test
	void leavesCanonicalValuesAlone() {
		assertThat(ArgumentNormalizer.normalize("akshare_search", Map.of("data_type", "realtime")))
				.containsEntry("data_type", "realtime");
	}

	@Test
	void onlyAppliesToToolsThatDeclareCoercions() {
		assertThat(ArgumentNormalizer.normalize("lookup", Map.of("data_type", "daily_history")))
				.containsEntry("data_type", "daily_history");
		assertThat(ArgumentNormalizer.normalize("retrieve_reports", Map.of("data_type", "daily_history")))
				.containsEntry("data_type", "daily_history");
	}
}
