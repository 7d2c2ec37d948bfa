package dev.subfetch.install;

import static org.assertj.core.api.Assertions.*;

import dev.subfetch.util.CommandResult;
import dev.subfetch.util.DummyProcessRunner;
import dev.subfetch.util.Platform;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class PythonEnvironmentTest {

	@Test
	void testPythonVersion() {
		// Given
		DummyProcessRunner runner = new DummyProcessRunner(Platform.LINUX)
				.respond("python3 --version", 0, "Python 2.7.18")
				.respond("python --version", new CommandResult(0, "", "Python 3.11.4\n"));

		// When/Then
		assertThat(new PythonEnvironment(runner).pythonVersion()).contains("Python 3.11.4");
	}

	@Test
	void testNoPython() {
		DummyProcessRunner runner = new DummyProcessRunner(Platform.LINUX);

		assertThat(new PythonEnvironment(runner).pythonVersion()).isEmpty();
		assertThat(runner.getCommandLines())
				.containsExactly("python3 --version", "python --version", "py --version");
	}

	@Test
	void testPipxOnlyProbedOnLinux() {
		DummyProcessRunner mac = new DummyProcessRunner(Platform.MACOS);
		DummyProcessRunner linux = new DummyProcessRunner(Platform.LINUX).respond("pipx --version", 0, "1.4.3");

		assertThat(new PythonEnvironment(mac).isAvailable(Stage.PACKAGE_MANAGER)).isTrue();
		assertThat(mac.getCommands()).isEmpty();
		assertThat(new PythonEnvironment(linux).isAvailable(Stage.PACKAGE_MANAGER)).isTrue();
		assertThat(new PythonEnvironment(new DummyProcessRunner(Platform.LINUX)).isAvailable(Stage.PACKAGE_MANAGER))
				.isFalse();
	}

	@Test
	void testSubliminalFoundAsCommand() {
		DummyProcessRunner runner =
				new DummyProcessRunner(Platform.LINUX).respond("subliminal --version", 0, "subliminal, version 2.2.1");

		assertThat(new PythonEnvironment(runner).isAvailable(Stage.FETCH_TOOL)).isTrue();
		assertThat(runner.getCommands()).hasSize(1);
	}

	@Test
	void testSubliminalFoundInPipxList() {
		DummyProcessRunner runner = new DummyProcessRunner(Platform.LINUX)
				.respond("pipx list", 0, "venvs are in ~/.local/pipx/venvs\n   package subliminal 2.2.1");

		assertThat(new PythonEnvironment(runner).isAvailable(Stage.FETCH_TOOL)).isTrue();
	}

	@Test
	void testSubliminalFoundWithPipShow() {
		// Given
		DummyProcessRunner runner = new DummyProcessRunner(Platform.LINUX)
				.respond("python -m pip show subliminal", 0, "Name: subliminal\nVersion: 2.2.1");

		// When
		boolean installed = new PythonEnvironment(runner).isAvailable(Stage.FETCH_TOOL);

		// Then
		assertThat(installed).isTrue();
		assertThat(runner.getCommandLines())
				.containsExactly(
						"subliminal --version",
						"pipx list",
						"python3 -m pip show subliminal",
						"python3 -c import subliminal; print('subliminal available')",
						"python -m pip show subliminal");
	}

	@Test
	void testSubliminalNotInstalled() {
		DummyProcessRunner runner = new DummyProcessRunner(Platform.LINUX)
				.respond("pipx list", 0, "nothing has been installed with pipx")
				.respond("python3 -m pip show", new CommandResult(1, "", "WARNING: Package(s) not found"));

		assertThat(new PythonEnvironment(runner).isAvailable(Stage.FETCH_TOOL)).isFalse();
	}

	@Test
	void testInstallPipxTriesEachMethod() throws Exception {
		// Given
		DummyProcessRunner runner = new DummyProcessRunner(Platform.LINUX)
				.respond("python3 -m pip install", new CommandResult(1, "", "externally-managed-environment"))
				.respond("apt install", 0, "");

		// When
		new PythonEnvironment(runner).install(Stage.PACKAGE_MANAGER);

		// Then
		assertThat(runner.getCommandLines())
				.containsExactly(
						"python3 -m pip install --user pipx",
						"python -m pip install --user pipx",
						"apt install -y python3-pipx");
	}

	@Test
	void testInstallPipxFails() {
		DummyProcessRunner runner = new DummyProcessRunner(Platform.LINUX);

		assertThatThrownBy(() -> new PythonEnvironment(runner).install(Stage.PACKAGE_MANAGER))
				.isInstanceOfSatisfying(
						InstallException.class, e -> assertThat(e.stage()).isEqualTo(Stage.PACKAGE_MANAGER));
		assertThat(runner.getCommands()).hasSize(PythonEnvironment.PIPX_INSTALL_ATTEMPTS.size());
	}

	@Test
	void testInstallPipxIsNoOpOffLinux() throws Exception {
		DummyProcessRunner runner = new DummyProcessRunner(Platform.MACOS);

		new PythonEnvironment(runner).install(Stage.PACKAGE_MANAGER);

		assertThat(runner.getCommands()).isEmpty();
	}

	@Test
	void testInstallSubliminalWithPipx() throws Exception {
		// Given
		DummyProcessRunner runner = new DummyProcessRunner(Platform.MACOS).respond("pipx install subliminal", 0, "done");

		// When
		new PythonEnvironment(runner).install(Stage.FETCH_TOOL);

		// Then
		assertThat(runner.getCommandLines()).containsExactly("pipx install subliminal");
	}

	@Test
	void testInstallSubliminalFallsBackToPip() throws Exception {
		// Given
		DummyProcessRunner runner = new DummyProcessRunner(Platform.LINUX)
				.respond("pipx --version", 0, "1.4.3")
				.respond("pipx install", new CommandResult(1, "", "boom"))
				.respond("python -m pip install --user subliminal", 0, "");

		// When
		new PythonEnvironment(runner).install(Stage.FETCH_TOOL);

		// Then
		assertThat(runner.getCommandLines())
				.containsExactly(
						"pipx --version",
						"pipx install subliminal",
						"python3 -m pip install --user subliminal",
						"python -m pip install --user subliminal");
	}

	@Test
	void testInstallSubliminalFails() {
		DummyProcessRunner runner = new DummyProcessRunner(Platform.MACOS);

		assertThatThrownBy(() -> new PythonEnvironment(runner).install(Stage.FETCH_TOOL))
				.isInstanceOf(InstallException.class)
				.hasMessage("pipx/pip install failed");
	}

	@Test
	void testInstallSubliminalOnWindows() throws Exception {
		// Given
		DummyProcessRunner runner = new DummyProcessRunner(Platform.WINDOWS)
				.respond("py -m pip install subliminal", 0, "")
				.respond("python -m site --user-base", 0, "/home/user/pybase\n");

		// When
		new PythonEnvironment(runner).install(Stage.FETCH_TOOL);

		// Then
		assertThat(runner.getCommandLines())
				.containsExactly(
						"python -m pip install subliminal",
						"py -m pip install subliminal",
						"python -m site --user-base");
		assertThat(runner.searchPath()).contains(Path.of("/home/user/pybase", "Scripts"));
	}
}
