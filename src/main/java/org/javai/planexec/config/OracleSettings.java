package org.javai.planexec.config;

/**
 * Connection settings for the OpenAI-compatible chat model behind the oracle.
 *
 * @param baseUrl API base URL; point it at a local OpenAI-compatible server to use a local model
 * @param apiKey API key, may be a placeholder for servers that ignore it
 * @param model model name
 * @param temperature sampling temperature
 */
public record OracleSettings(
		String baseUrl,
		String apiKey,
		String model,
		double temperature
) {

	public static final String DEFAULT_BASE_URL = "https://api.openai.com";
	public static final String DEFAULT_MODEL = "gpt-4.1-mini";
	public static final double DEFAULT_TEMPERATURE = 0.1;

	public OracleSettings {
		baseUrl = baseUrl != null && !baseUrl.isBlank() ? baseUrl : DEFAULT_BASE_URL;
		model = model != null && !model.isBlank() ? model : DEFAULT_MODEL;
		if (temperature < 0.0) {
			throw new IllegalArgumentException("temperature must be non-negative");
		}
	}

	public static OracleSettings defaults() {
		return new OracleSettings(DEFAULT_BASE_URL, System.getenv("OPENAI_API_KEY"), DEFAULT_MODEL, DEFAULT_TEMPERATURE);
	}
}
