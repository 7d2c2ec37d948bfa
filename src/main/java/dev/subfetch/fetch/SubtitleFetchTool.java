package dev.subfetch.fetch;

import dev.subfetch.util.CommandResult;
import java.nio.file.Path;

/**
 * The external subtitle fetching tool. Implementations launch the tool for one video file and
 * return whatever it printed; the exit code is not treated as the success signal.
 */
public interface SubtitleFetchTool {

	/**
	 * Fetch subtitles for a single video.
	 *
	 * @param target The video file
	 * @param options Languages and force flags
	 * @return The captured output of the first invocation that could be launched
	 * @throws ToolLaunchException If no invocation form of the tool could be started
	 * @throws InterruptedException If interrupted while the tool was running
	 */
	CommandResult download(Path target, FetchOptions options) throws ToolLaunchException, InterruptedException;
}
