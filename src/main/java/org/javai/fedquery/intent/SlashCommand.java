package org.javai.fedquery.intent;

import java.util.Locale;
import java.util.Optional;

/**
 * Commands a user can type to steer the conversation. They are recognised before
 * classification and bypass it.
 */
public enum SlashCommand {
	/** {@code /new}, {@code /reset}, {@code /clear}: drop history; an optional payload is answered afresh. */
	NEW_CONVERSATION("/new", "/reset", "/clear"),
	/** {@code /chat}, {@code /talk}: answer the payload conversationally. */
	FORCE_CONVERSATION("/chat", "/talk");

	private final String[] aliases;

	SlashCommand(String... aliases) {
		this.aliases = aliases;
	}

	/**
	 * A recognised command and the text that followed it.
	 */
	public record Invocation(SlashCommand command, String payload) {

		public boolean hasPayload() {
			return payload != null && !payload.isBlank();
		}
	}

	public static Optional<Invocation> parse(String input) {
		if (input == null) {
			return Optional.empty();
		}
		String trimmed = input.trim();
		if (!trimmed.startsWith("/")) {
			return Optional.empty();
		}
		int space = indexOfWhitespace(trimmed);
		String head = (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);
		String payload = space < 0 ? "" : trimmed.substring(space).trim();
		for (SlashCommand command : values()) {
			for (String alias : command.aliases) {
				if (alias.equals(head)) {
					return Optional.of(new Invocation(command, payload));
				}
			}
		}
		return Optional.empty();
	}

	private static int indexOfWhitespace(String text) {
		for (int i = 0; i < text.length(); i++) {
			if (Character.isWhitespace(text.charAt(i))) {
				return i;
			}
		}
		return -1;
	}
}
