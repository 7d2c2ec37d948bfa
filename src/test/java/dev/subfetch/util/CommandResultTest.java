package dev.subfetch.util;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CommandResultTest {

	@Test
	void testCombinedLowercaseJoinsBothStreams() {
		// Given
		CommandResult result = new CommandResult(1, "Downloaded 0 Subtitles\n", "ERROR: dbm.error");

		// When
		String combined = result.combinedLowercase();

		// Then
		assertThat(combined).isEqualTo("downloaded 0 subtitles\n\nerror: dbm.error");
		assertThat(result.success()).isFalse();
	}

	@Test
	void testCombinedLowercaseOfEmptyOutput() {
		CommandResult result = new CommandResult(0, "", "");

		assertThat(result.combinedLowercase()).isEmpty();
		assertThat(result.success()).isTrue();
	}
}
