package dev.subfetch.util;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launches external commands without a console window, capturing their standard output and
 * standard error. Commands are resolved against extra search directories first (for tools that
 * were installed while the application is running) and then against the inherited PATH.
 */
public class ProcessRunner {
	private static final Logger logger = LoggerFactory.getLogger(ProcessRunner.class);

	private final Platform platform;
	private final List<Path> extraSearchPath = new CopyOnWriteArrayList<>();

	public ProcessRunner() {
		this(Platform.current());
	}

	public ProcessRunner(Platform platform) {
		this.platform = platform;
	}

	public Platform platform() {
		return platform;
	}

	/** Make executables in the given directory resolvable ahead of the inherited PATH */
	public void addSearchPath(Path directory) {
		if (!extraSearchPath.contains(directory)) {
			extraSearchPath.add(0, directory);
			logger.debug("Added {} to the executable search path", directory);
		}
	}

	public List<Path> searchPath() {
		return List.copyOf(extraSearchPath);
	}

	/**
	 * Run a command to completion.
	 *
	 * @param command The command name followed by its arguments
	 * @param environment Extra environment variables for the child process
	 * @return The exit code and captured output
	 * @throws IOException If the process could not be started (e.g. the command does not exist)
	 * @throws ProcessOutputException If the process started but its output could not be read
	 * @throws InterruptedException If interrupted while waiting for the process
	 */
	public CommandResult run(List<String> command, Map<String, String> environment)
			throws IOException, InterruptedException {
		List<String> resolved = new ArrayList<>(command);
		resolved.set(0, resolve(command.get(0)));

		ProcessBuilder pb = new ProcessBuilder(resolved);
		pb.environment().putAll(environment);
		if (!platform.isWindows()) {
			pb.environment().put("DEBIAN_FRONTEND", "noninteractive");
			pb.environment().put("PYTHONUNBUFFERED", "1");
		}

		Process process = pb.start();
		ByteArrayOutputStream stderr = new ByteArrayOutputStream();
		Thread drainer = new Thread(() -> drain(process.getErrorStream(), stderr), "stderr-" + command.get(0));
		drainer.setDaemon(true);
		boolean finished = false;
		try {
			process.getOutputStream().close();
			drainer.start();

			byte[] stdout;
			try (InputStream in = process.getInputStream()) {
				stdout = in.readAllBytes();
			}
			int exitCode = process.waitFor();
			drainer.join();
			finished = true;

			CommandResult result = new CommandResult(
					exitCode,
					new String(stdout, StandardCharsets.UTF_8),
					stderr.toString(StandardCharsets.UTF_8));
			logger.trace("{} finished with {}", String.join(" ", command), result);
			return result;
		} catch (IOException e) {
			throw new ProcessOutputException("Failed to read output of " + command.get(0) + ": " + e.getMessage(), e);
		} finally {
			if (!finished) {
				stop(process, drainer);
			}
		}
	}

	/** Run a command without extra environment variables */
	public CommandResult run(String... command) throws IOException, InterruptedException {
		return run(List.of(command), Map.of());
	}

	String resolve(String name) {
		for (Path dir : extraSearchPath) {
			Path candidate = dir.resolve(name);
			if (Files.isExecutable(candidate) && !Files.isDirectory(candidate)) {
				return candidate.toString();
			}
			if (platform.isWindows()) {
				Path exe = dir.resolve(name + ".exe");
				if (Files.isExecutable(exe)) {
					return exe.toString();
				}
			}
		}
		return name;
	}

	private static void stop(Process process, Thread drainer) {
		process.destroyForcibly();
		if (drainer.isAlive()) {
			try {
				drainer.join(1000);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}
	}

	private static void drain(InputStream in, ByteArrayOutputStream sink) {
		try (in) {
			in.transferTo(sink);
		} catch (IOException e) {
			logger.debug("Failed to read process error stream: {}", e.getMessage());
		}
	}
}
