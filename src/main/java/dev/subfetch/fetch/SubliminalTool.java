package dev.subfetch.fetch;

import dev.subfetch.util.CommandResult;
import dev.subfetch.util.FileUtils;
import dev.subfetch.util.ProcessOutputException;
import dev.subfetch.util.ProcessRunner;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the {@code subliminal} command line tool. If the {@code subliminal} executable cannot be
 * launched, the tool is run as a Python module through each interpreter of the fallback chain in
 * turn; the first invocation that starts is used whatever its exit code. A started invocation whose
 * output cannot be read is not retried.
 */
public class SubliminalTool implements SubtitleFetchTool {
	private static final Logger logger = LoggerFactory.getLogger(SubliminalTool.class);

	public static final String COMMAND = "subliminal";
	static final List<String> FALLBACK_INTERPRETERS = List.of("python", "py", "python3");

	private final ProcessRunner runner;
	private final Path cacheDir;

	public SubliminalTool(ProcessRunner runner) {
		this(runner, Path.of(System.getProperty("java.io.tmpdir")).resolve("subliminal_cache"));
	}

	public SubliminalTool(ProcessRunner runner, Path cacheDir) {
		this.runner = runner;
		this.cacheDir = cacheDir;
	}

	@Override
	public CommandResult download(Path target, FetchOptions options) throws ToolLaunchException, InterruptedException {
		List<String> args = arguments(target, options);
		Map<String, String> env = environment();

		IOException lastFailure = null;
		for (List<String> command : invocations(args)) {
			try {
				logger.debug("Running {}", String.join(" ", command));
				return runner.run(command, env);
			} catch (ProcessOutputException e) {
				throw new UncheckedIOException(e.getMessage(), e);
			} catch (IOException e) {
				logger.debug("Could not launch {}: {}", command.get(0), e.getMessage());
				lastFailure = e;
			}
		}
		throw new ToolLaunchException("Could not launch " + COMMAND + " with any of its invocation forms", lastFailure);
	}

	/** The {@code download} argument list: force flag, one {@code -l} pair per language, then the file */
	static List<String> arguments(Path target, FetchOptions options) {
		List<String> args = new ArrayList<>();
		args.add("download");
		if (options.forceFlag()) {
			args.add("--force");
		}
		for (String language : options.languages()) {
			args.add("-l");
			args.add(language);
		}
		args.add(target.toString());
		return args;
	}

	/** The primary command followed by the module invocations of the fallback chain */
	static List<List<String>> invocations(List<String> args) {
		List<List<String>> commands = new ArrayList<>();
		List<String> direct = new ArrayList<>();
		direct.add(COMMAND);
		direct.addAll(args);
		commands.add(direct);
		for (String interpreter : FALLBACK_INTERPRETERS) {
			List<String> module = new ArrayList<>(List.of(interpreter, "-m", COMMAND));
			module.addAll(args);
			commands.add(module);
		}
		return commands;
	}

	Map<String, String> environment() {
		try {
			FileUtils.ensureDirectory(cacheDir);
		} catch (IOException e) {
			logger.warn("Could not create cache directory {}: {}", cacheDir, e.getMessage());
		}
		Map<String, String> env = new LinkedHashMap<>();
		env.put("PYTHONIOENCODING", "utf-8");
		env.put("SUBLIMINAL_CACHE_DIR", cacheDir.toString());
		env.put("PYTHONHASHSEED", "0");
		if (runner.platform().isWindows()) {
			// The dbm cache backend is unreliable on Windows
			env.put("SUBLIMINAL_CACHE_BACKEND", "memory");
			env.put("PYTHONPATH", System.getenv().getOrDefault("PYTHONPATH", ""));
		}
		return env;
	}
}
