package org.javai.fedquery.intent;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SlashCommandTest {

	@Test
	@DisplayName("recognises aliases ignoring case")
	void aliases() {
		assertThat(SlashCommand.parse("/NEW")).map(SlashCommand.Invocation::command).contains(SlashCommand.NEW_CONVERSATION);
		assertThat(SlashCommand.parse("/reset")).map(SlashCommand.Invocation::command).contains(SlashCommand.NEW_CONVERSATION);
		assertThat(SlashCommand.parse("/talk hello")).map(SlashCommand.Invocation::command).contains(SlashCommand.FORCE_CONVERSATION);
	}

	@Test
	@DisplayName("keeps the text after the command as payload")
	void payload() {
		SlashCommand.Invocation invocation = SlashCommand.parse("  /new   show top 5 customers ").orElseThrow();

		assertThat(invocation.hasPayload()).isTrue();
		assertThat(invocation.payload()).isEqualTo("show top 5 customers");
		assertThat(SlashCommand.parse("/clear").orElseThrow().hasPayload()).isFalse();
	}

	@Test
	@DisplayName("ignores unknown commands and plain text")
	void notCommands() {
		assertThat(SlashCommand.parse("/help")).isEmpty();
		assertThat(SlashCommand.parse("/newest orders")).isEmpty();
		assertThat(SlashCommand.parse("show /new")).isEmpty();
		assertThat(SlashCommand.parse(null)).isEmpty();
	}
}
