package dev.subfetch.util;

import java.util.Comparator;

/** Orders dotted release versions numerically, ignoring a leading {@code v} (as in {@code v2.1.0}) */
public class VersionComparator implements Comparator<String> {
	public static final Comparator<String> INSTANCE = new VersionComparator();

	@Override
	public int compare(String v1, String v2) {
		if (v1 == null && v2 == null) return 0;
		if (v1 == null) return -1;
		if (v2 == null) return 1;
		String[] parts1 = strip(v1).split("\\.");
		String[] parts2 = strip(v2).split("\\.");

		int length = Math.min(parts1.length, parts2.length);
		for (int i = 0; i < length; i++) {
			int cmp = Integer.compare(parseToInt(parts1[i]), parseToInt(parts2[i]));
			if (cmp != 0) {
				return cmp;
			}
		}
		// 1.0 sorts before 1.0.1
		return Integer.compare(parts1.length, parts2.length);
	}

	/** True if {@code current} is an older release than {@code latest} */
	public static boolean isOutdated(String current, String latest) {
		return INSTANCE.compare(current, latest) < 0;
	}

	private static String strip(String version) {
		String trimmed = version.trim();
		while (trimmed.startsWith("v") || trimmed.startsWith("V")) {
			trimmed = trimmed.substring(1);
		}
		return trimmed;
	}

	// Unparsable components count as 0
	private static int parseToInt(String number) {
		try {
			return Integer.parseInt(number.trim());
		} catch (NumberFormatException ex) {
			return 0;
		}
	}
}
