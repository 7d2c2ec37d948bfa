package dev.subfetch;

import dev.subfetch.config.Settings;
import dev.subfetch.subtitle.ScanResult;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/** Lists the videos of a folder that are missing subtitles */
@Command(
		name = "scan",
		description = "List videos that are missing subtitles for the selected languages",
		mixinStandardHelpOptions = true)
public class ScanCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@ParentCommand
	private Main parent;

	@Parameters(index = "0", description = "Folder to scan recursively")
	private Path folder;

	@Option(
			names = {"-l", "--language"},
			description = "Subtitle language code, repeatable (default: the saved languages)")
	private List<String> languages;

	@Option(
			names = {"--ignore-extras"},
			description = "Skip local extras folders such as 'Featurettes' and 'Trailers'")
	private boolean ignoreExtras;

	@Override
	public Integer call() {
		Settings settings = parent.context().settings();
		List<String> selected = languages != null && !languages.isEmpty() ? languages : settings.languages();
		if (selected.isEmpty()) {
			logger.error("No language selected, use -l/--language");
			return 2;
		}

		ScanResult result;
		try {
			result = parent.context()
					.videoScanner(ignoreExtras || settings.ignoreLocalExtras())
					.scan(folder, selected, false);
		} catch (IOException e) {
			logger.error("Error: Cannot scan {}: {}", folder, e.getMessage());
			return 1;
		}

		for (Path video : result.missing()) {
			logger.info(video.toString());
		}
		logger.info("");
		logger.info("Videos found: {}", result.videos().size());
		logger.info("Missing subtitles: {}", result.missing().size());
		if (result.ignoredFolders() > 0) {
			logger.info("Extras folders ignored: {}", result.ignoredFolders());
		}
		return 0;
	}
}
