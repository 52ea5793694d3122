package org.javai.fedquery.analysis;

/**
 * Retrieval paths taken for a request.
 */
public enum Route {
	/** Small talk; no retrieval. */
	CONVERSATION,
	DATABASE_ONLY,
	DOCUMENT_ONLY,
	/** Database and document paths both run and are merged. */
	HYBRID;

	public boolean usesDatabases() {
		return this == DATABASE_ONLY || this == HYBRID;
	}

	public boolean usesDocuments() {
		return this == DOCUMENT_ONLY || this == HYBRID;
	}
}
