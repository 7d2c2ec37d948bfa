package dev.subfetch.fetch;

import static org.assertj.core.api.Assertions.*;

import dev.subfetch.util.CommandResult;
import dev.subfetch.util.DummyProcessRunner;
import dev.subfetch.util.Platform;
import dev.subfetch.util.ProcessOutputException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SubliminalToolTest {

	@TempDir
	Path tempDir;

	@Test
	void testArguments() {
		// Given
		Path video = Path.of("/videos/Movie.mkv");
		FetchOptions options = new FetchOptions(List.of("en", "fr"), false, false);

		// When
		List<String> args = SubliminalTool.arguments(video, options);

		// Then
		assertThat(args).containsExactly("download", "-l", "en", "-l", "fr", video.toString());
	}

	@Test
	void testForceAndOverwriteAddForceOnce() {
		Path video = Path.of("Movie.mkv");

		assertThat(SubliminalTool.arguments(video, new FetchOptions(List.of("en"), true, true)))
				.containsExactly("download", "--force", "-l", "en", "Movie.mkv");
		assertThat(SubliminalTool.arguments(video, new FetchOptions(List.of("en"), false, true)))
				.containsExactly("download", "--force", "-l", "en", "Movie.mkv");
	}

	@Test
	void testPrimaryInvocation() throws Exception {
		// Given
		DummyProcessRunner runner =
				new DummyProcessRunner(Platform.LINUX).respond("subliminal download", 0, "Downloaded 1 subtitle");
		SubliminalTool tool = new SubliminalTool(runner, tempDir.resolve("cache"));

		// When
		CommandResult result = tool.download(Path.of("Movie.mkv"), new FetchOptions(List.of("en"), false, false));

		// Then
		assertThat(result.stdout()).isEqualTo("Downloaded 1 subtitle");
		assertThat(runner.getCommandLines()).containsExactly("subliminal download -l en Movie.mkv");
	}

	@Test
	void testFallbackChain() throws Exception {
		// Given
		DummyProcessRunner runner = new DummyProcessRunner(Platform.LINUX)
				.respond("python3 -m subliminal", 1, "Downloaded 0 subtitles");
		SubliminalTool tool = new SubliminalTool(runner, tempDir.resolve("cache"));

		// When
		CommandResult result = tool.download(Path.of("Movie.mkv"), new FetchOptions(List.of("en"), false, false));

		// Then
		assertThat(result.exitCode()).isEqualTo(1);
		assertThat(runner.getCommandLines())
				.containsExactly(
						"subliminal download -l en Movie.mkv",
						"python -m subliminal download -l en Movie.mkv",
						"py -m subliminal download -l en Movie.mkv",
						"python3 -m subliminal download -l en Movie.mkv");
	}

	@Test
	void testNothingLaunchable() {
		// Given
		DummyProcessRunner runner = new DummyProcessRunner(Platform.LINUX);
		SubliminalTool tool = new SubliminalTool(runner, tempDir.resolve("cache"));

		// When/Then
		assertThatThrownBy(() -> tool.download(Path.of("Movie.mkv"), new FetchOptions(List.of("en"), false, false)))
				.isInstanceOf(ToolLaunchException.class)
				.hasCauseInstanceOf(IOException.class);
		assertThat(runner.getCommands()).hasSize(4);
	}

	@Test
	void testUnreadableOutputIsNotRetried() {
		// Given
		DummyProcessRunner runner = new DummyProcessRunner(Platform.LINUX)
				.failReading("subliminal download")
				.respond("python -m subliminal", 0, "Downloaded 1 subtitle");
		SubliminalTool tool = new SubliminalTool(runner, tempDir.resolve("cache"));

		// When/Then
		assertThatThrownBy(() -> tool.download(Path.of("Movie.mkv"), new FetchOptions(List.of("en"), false, false)))
				.isInstanceOf(UncheckedIOException.class)
				.hasCauseInstanceOf(ProcessOutputException.class)
				.hasMessageContaining("Stream closed");
		assertThat(runner.getCommandLines()).containsExactly("subliminal download -l en Movie.mkv");
	}

	@Test
	void testEnvironment() throws Exception {
		// Given
		Path cacheDir = tempDir.resolve("subliminal_cache");
		DummyProcessRunner runner = new DummyProcessRunner(Platform.LINUX).respond("subliminal", 0, "");
		SubliminalTool tool = new SubliminalTool(runner, cacheDir);

		// When
		tool.download(Path.of("Movie.mkv"), new FetchOptions(List.of("en"), false, false));

		// Then
		Map<String, String> env = runner.getEnvironments().get(0);
		assertThat(env)
				.containsEntry("PYTHONIOENCODING", "utf-8")
				.containsEntry("SUBLIMINAL_CACHE_DIR", cacheDir.toString())
				.containsEntry("PYTHONHASHSEED", "0")
				.doesNotContainKey("SUBLIMINAL_CACHE_BACKEND");
		assertThat(Files.isDirectory(cacheDir)).isTrue();
	}

	@Test
	void testWindowsEnvironmentUsesMemoryCache() {
		DummyProcessRunner runner = new DummyProcessRunner(Platform.WINDOWS);
		SubliminalTool tool = new SubliminalTool(runner, tempDir.resolve("cache"));

		assertThat(tool.environment())
				.containsEntry("SUBLIMINAL_CACHE_BACKEND", "memory")
				.containsKey("PYTHONPATH");
	}
}
