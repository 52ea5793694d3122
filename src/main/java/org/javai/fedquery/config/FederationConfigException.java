package org.javai.fedquery.config;

/**
 * Thrown when federation configuration cannot be read or is inconsistent.
 */
public class FederationConfigException extends RuntimeException {

	public FederationConfigException(String message) {
		super(message);
	}

	public FederationConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
