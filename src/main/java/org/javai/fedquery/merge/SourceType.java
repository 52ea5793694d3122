package org.javai.fedquery.merge;

public enum SourceType {
	DATABASE,
	DOCUMENT
}
