package org.javai.planexec.oracle;

/**
 * Raised when the oracle could not produce a response.
 */
public class OracleException extends RuntimeException {

	public OracleException(String message) {
		super(message);
	}

	public OracleException(String message, Throwable cause) {
		super(message, cause);
	}
}
