package dev.subfetch.subtitle;

import static org.assertj.core.api.Assertions.*;

import dev.subfetch.util.DummyProcessRunner;
import dev.subfetch.util.Platform;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class FfprobeEmbeddedSubtitleProbeTest {

	private static final Path VIDEO = Path.of("Movie.mkv");

	@Test
	void testMatchLanguage() {
		String output = "2,eng\n3,fre\n";

		assertThat(FfprobeEmbeddedSubtitleProbe.matchLanguage(output, List.of("fr"))).contains("French");
		assertThat(FfprobeEmbeddedSubtitleProbe.matchLanguage(output, List.of("de", "en"))).contains("English");
		assertThat(FfprobeEmbeddedSubtitleProbe.matchLanguage(output, List.of("de"))).isEmpty();
	}

	@Test
	void testStreamsWithoutLanguageTagAreIgnored() {
		assertThat(FfprobeEmbeddedSubtitleProbe.matchLanguage("2\n3,\n", List.of("en"))).isEmpty();
		assertThat(FfprobeEmbeddedSubtitleProbe.matchLanguage("", List.of("en"))).isEmpty();
	}

	@Test
	void testProbeRunsFfprobe() {
		// Given
		DummyProcessRunner runner = new DummyProcessRunner(Platform.LINUX).respond("ffprobe", 0, "2,EN\r\n");

		// When
		var language = new FfprobeEmbeddedSubtitleProbe(runner).findEmbeddedLanguage(VIDEO, List.of("en"));

		// Then
		assertThat(language).contains("English");
		assertThat(runner.getCommands().get(0)).startsWith("ffprobe").endsWith("Movie.mkv");
	}

	@Test
	void testFfprobeFailureMeansNothingEmbedded() {
		DummyProcessRunner runner = new DummyProcessRunner(Platform.LINUX).respond("ffprobe", 1, "2,eng");

		assertThat(new FfprobeEmbeddedSubtitleProbe(runner).findEmbeddedLanguage(VIDEO, List.of("en")))
				.isEmpty();
	}

	@Test
	void testMissingFfprobeMeansNothingEmbedded() {
		DummyProcessRunner runner = new DummyProcessRunner(Platform.LINUX);

		assertThat(new FfprobeEmbeddedSubtitleProbe(runner).findEmbeddedLanguage(VIDEO, List.of("en")))
				.isEmpty();
	}
}
