package dev.subfetch.subtitle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Human readable names of the language codes the subtitle tool accepts */
public class Languages {

	private static final Map<String, String> NAMES;

	static {
		Map<String, String> names = new LinkedHashMap<>();
		// Regional variants
		names.put("en", "English");
		names.put("en-us", "English (US)");
		names.put("en-gb", "English (UK)");
		names.put("fr", "French");
		names.put("fr-ca", "French (Canada)");
		names.put("es", "Spanish");
		names.put("es-mx", "Spanish (Mexico)");
		names.put("es-es", "Spanish (Spain)");
		names.put("de", "German");
		names.put("de-at", "German (Austria)");
		names.put("de-ch", "German (Switzerland)");
		names.put("it", "Italian");
		names.put("it-ch", "Italian (Switzerland)");
		names.put("pt", "Portuguese");
		names.put("pt-br", "Portuguese (Brazil)");
		names.put("pt-pt", "Portuguese (Portugal)");
		names.put("nl", "Dutch");
		names.put("nl-be", "Dutch (Belgium)");
		// European
		names.put("pl", "Polish");
		names.put("ru", "Russian");
		names.put("sv", "Swedish");
		names.put("fi", "Finnish");
		names.put("da", "Danish");
		names.put("no", "Norwegian");
		names.put("cs", "Czech");
		names.put("hu", "Hungarian");
		names.put("ro", "Romanian");
		names.put("bg", "Bulgarian");
		names.put("hr", "Croatian");
		names.put("et", "Estonian");
		names.put("el", "Greek");
		names.put("is", "Icelandic");
		names.put("lv", "Latvian");
		names.put("lt", "Lithuanian");
		names.put("mt", "Maltese");
		names.put("sk", "Slovak");
		names.put("sl", "Slovenian");
		names.put("tr", "Turkish");
		names.put("uk", "Ukrainian");
		// Asian
		names.put("he", "Hebrew");
		names.put("ar", "Arabic");
		names.put("ja", "Japanese");
		names.put("ko", "Korean");
		names.put("zh", "Chinese");
		names.put("zh-cn", "Chinese (Simplified)");
		names.put("zh-tw", "Chinese (Traditional)");
		names.put("th", "Thai");
		names.put("vi", "Vietnamese");
		names.put("id", "Indonesian");
		names.put("ms", "Malay");
		names.put("fil", "Filipino/Tagalog");
		names.put("bn", "Bengali");
		names.put("hi", "Hindi");
		names.put("ur", "Urdu");
		names.put("fa", "Persian/Farsi");
		// African
		names.put("af", "Afrikaans");
		names.put("sw", "Swahili");
		names.put("zu", "Zulu");
		names.put("xh", "Xhosa");
		// Middle Eastern and Caucasian
		names.put("ku", "Kurdish");
		names.put("az", "Azerbaijani");
		names.put("ka", "Georgian");
		names.put("am", "Amharic");
		// Indian subcontinent
		names.put("ta", "Tamil");
		names.put("te", "Telugu");
		names.put("kn", "Kannada");
		names.put("ml", "Malayalam");
		names.put("gu", "Gujarati");
		names.put("pa", "Punjabi");
		names.put("or", "Odia");
		// East and South-East Asian
		names.put("mn", "Mongolian");
		names.put("my", "Burmese");
		names.put("lo", "Lao");
		names.put("km", "Khmer");
		NAMES = Collections.unmodifiableMap(names);
	}

	/** The display name of a language code, or the code itself if it is not known */
	public static String displayName(String code) {
		return NAMES.getOrDefault(code.toLowerCase(Locale.ROOT), code);
	}

	public static boolean isKnown(String code) {
		return NAMES.containsKey(code.toLowerCase(Locale.ROOT));
	}

	/** All known codes in display order */
	public static Map<String, String> all() {
		return NAMES;
	}
}
