package org.javai.fedquery.intent;

/**
 * Thrown when a query cannot even be tokenized, so no classification is possible.
 */
public class UnclassifiableQueryException extends RuntimeException {

	public UnclassifiableQueryException(String message) {
		super(message);
	}
}
