package dev.subfetch;

import dev.subfetch.config.AppContext;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "subfetch",
		version = AppContext.VERSION,
		description = "Downloads missing subtitles for a video library using subliminal",
		mixinStandardHelpOptions = true,
		subcommands = {DownloadCommand.class, ScanCommand.class, StatusCommand.class})
public class Main implements Callable<Integer> {

	@Spec
	private CommandSpec spec;

	private final AppContext context;

	public Main(AppContext context) {
		this.context = context;
	}

	AppContext context() {
		return context;
	}

	@Override
	public Integer call() {
		spec.commandLine().usage(System.out);
		return 2;
	}

	public static void main(String[] args) {
		int exitCode;
		try (AppContext context = AppContext.create()) {
			exitCode = new CommandLine(new Main(context)).execute(args);
		}
		System.exit(exitCode);
	}
}
