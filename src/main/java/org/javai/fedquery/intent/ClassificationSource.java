package org.javai.fedquery.intent;

public enum ClassificationSource {
	/** Decided by the heuristic pass without any model call. */
	HEURISTIC,
	/** Decided from a parsed JSON verdict. */
	AI,
	/** Decided by scanning unparseable model output for a verdict keyword. */
	AI_KEYWORD,
	/** The model gave nothing usable; conversation was assumed. */
	DEFAULT,
	/** A conversation verdict overruled by the query's shape. */
	OVERRIDE,
	/** Forced by a slash command. */
	COMMAND
}
