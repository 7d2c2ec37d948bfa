package dev.subfetch.util;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRunnerTest {

	@TempDir
	Path tempDir;

	@Test
	void testCapturesOutputAndExitCode() throws Exception {
		// Given
		ProcessRunner runner = new ProcessRunner();

		// When
		CommandResult result = runner.run("sh", "-c", "echo out; echo err 1>&2; exit 3");

		// Then
		assertThat(result.exitCode()).isEqualTo(3);
		assertThat(result.stdout()).isEqualTo("out\n");
		assertThat(result.stderr()).isEqualTo("err\n");
	}

	@Test
	void testPassesEnvironment() throws Exception {
		// Given
		ProcessRunner runner = new ProcessRunner();

		// When
		CommandResult result = runner.run(List.of("sh", "-c", "echo $SUBFETCH_TEST-$PYTHONUNBUFFERED"), Map.of("SUBFETCH_TEST", "value"));

		// Then
		assertThat(result.stdout().trim()).isEqualTo("value-1");
	}

	@Test
	void testMissingCommandFailsToLaunch() {
		ProcessRunner runner = new ProcessRunner();

		assertThatThrownBy(() -> runner.run("subfetch-no-such-command-xyz"))
				.isInstanceOf(IOException.class);
	}

	@Test
	void testResolvesAgainstExtraSearchPath() throws Exception {
		// Given
		Path tool = tempDir.resolve("mytool");
		Files.writeString(tool, "#!/bin/sh\necho from-search-path\n");
		assertThat(tool.toFile().setExecutable(true)).isTrue();
		ProcessRunner runner = new ProcessRunner();

		// When
		runner.addSearchPath(tempDir);
		runner.addSearchPath(tempDir);
		CommandResult result = runner.run("mytool");

		// Then
		assertThat(runner.searchPath()).containsExactly(tempDir);
		assertThat(runner.resolve("mytool")).isEqualTo(tool.toString());
		assertThat(runner.resolve("other")).isEqualTo("other");
		assertThat(result.stdout().trim()).isEqualTo("from-search-path");
	}
}
