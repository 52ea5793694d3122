package org.javai.fedquery.sql;

/**
 * Result of a dialect syntax check.
 *
 * @param ok whether the statement passed
 * @param error why it failed, null when ok
 */
public record SyntaxCheck(boolean ok, String error) {

	private static final SyntaxCheck OK = new SyntaxCheck(true, null);

	public static SyntaxCheck passed() {
		return OK;
	}

	public static SyntaxCheck failed(String error) {
		return new SyntaxCheck(false, error);
	}
}
