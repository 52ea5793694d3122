package org.javai.fedquery.analysis;

/**
 * How well the selected databases are believed to satisfy a query.
 */
public enum ConfidenceBucket {
	HIGH,
	MEDIUM,
	LOW
}
