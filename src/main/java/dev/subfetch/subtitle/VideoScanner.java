package dev.subfetch.subtitle;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Walks a folder tree and collects the videos that are missing subtitles */
public class VideoScanner {
	private static final Logger logger = LoggerFactory.getLogger(VideoScanner.class);

	public static final Set<String> VIDEO_EXTENSIONS = Set.of(
			"mp4", "mkv", "avi", "mov", "wmv", "flv", "mpeg", "mpg", "webm", "m4v", "3gp", "3g2", "asf", "mts",
			"m2ts", "ts", "vob", "ogv", "rm", "rmvb", "divx", "f4v", "mxf", "mp2", "mpv", "dat", "tod", "vro",
			"drc", "mng", "qt", "yuv", "viv", "amv", "nsv", "svi", "mpe", "mpv2", "m2v", "m1v", "m2p", "trp",
			"tp", "ps", "evo", "ogm", "ogx", "mod", "rec", "dvr-ms", "pva", "wtv", "m4p", "m4b", "m4r", "m4a",
			"3gpp", "3gpp2");

	/** Folder names Plex uses for local extras */
	public static final Set<String> EXTRAS_FOLDERS = Set.of(
			"Behind The Scenes",
			"Deleted Scenes",
			"Featurettes",
			"Interviews",
			"Scenes",
			"Shorts",
			"Trailers",
			"Other");

	private final boolean ignoreExtras;

	public VideoScanner(boolean ignoreExtras) {
		this.ignoreExtras = ignoreExtras;
	}

	/**
	 * Scan a folder recursively.
	 *
	 * @param folder The root folder
	 * @param languages Requested language codes
	 * @param overwrite When true every video counts as missing
	 * @return The videos found and the ones that need a download
	 * @throws IOException if the root folder cannot be read
	 */
	public ScanResult scan(Path folder, List<String> languages, boolean overwrite) throws IOException {
		if (!Files.isDirectory(folder)) {
			throw new IOException("Not a directory: " + folder);
		}
		logger.info("Starting folder scan: {}", folder);
		if (ignoreExtras) {
			logger.info("Skipping local extras folders");
		}

		List<Path> videos = new ArrayList<>();
		int[] ignored = {0};
		Files.walkFileTree(folder, new SimpleFileVisitor<>() {
			@Override
			public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
				if (ignoreExtras && !dir.equals(folder) && isExtrasFolder(dir)) {
					logger.info("Ignoring local extras folder: {}", dir);
					ignored[0]++;
					return FileVisitResult.SKIP_SUBTREE;
				}
				return FileVisitResult.CONTINUE;
			}

			@Override
			public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
				if (attrs.isRegularFile() && isVideoFile(file)) {
					videos.add(file);
				}
				return FileVisitResult.CONTINUE;
			}

			@Override
			public FileVisitResult visitFileFailed(Path file, IOException e) {
				logger.warn("Cannot read {}: {}", file, e.getMessage());
				return FileVisitResult.CONTINUE;
			}
		});

		List<Path> missing;
		if (overwrite) {
			missing = videos;
			logger.info("Overwrite mode enabled, including all {} videos", videos.size());
		} else {
			missing = new ArrayList<>();
			for (Path video : videos) {
				if (SubtitleFiles.isMissingSubtitle(video, languages)) {
					missing.add(video);
				}
			}
		}
		logger.info("Folder scan completed: found {} videos, {} missing subtitles", videos.size(), missing.size());
		return new ScanResult(videos, missing, ignored[0]);
	}

	public static boolean isVideoFile(Path file) {
		Path name = file.getFileName();
		if (name == null) {
			return false;
		}
		String fileName = name.toString();
		int dot = fileName.lastIndexOf('.');
		if (dot < 0 || dot == fileName.length() - 1) {
			return false;
		}
		return VIDEO_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
	}

	static boolean isExtrasFolder(Path dir) {
		Path name = dir.getFileName();
		return name != null && EXTRAS_FOLDERS.contains(name.toString());
	}
}
