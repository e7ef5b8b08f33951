package my.hrddrisk.app.util;

import java.nio.charset.StandardCharsets;

public final class CsvParsing {
	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	/**
	 * Removes NUL characters and one pair of surrounding double quotes. Exported spreadsheets wrap whole lines
	 * as well as single cells.
	 */
	public static String stripWrappingQuotes(String value) {
		if (value == null) {
			return null;
		}
		String cleaned = value.replace("\0", "");
		if (cleaned.startsWith("\"")) {
			cleaned = cleaned.substring(1);
		}
		if (cleaned.endsWith("\"")) {
			cleaned = cleaned.substring(0, cleaned.length() - 1);
		}
		return cleaned;
	}

	public static double parseNumberOrZero(String value) {
		if (value == null || value.isBlank()) {
			return 0.0;
		}
		try {
			double parsed = Double.parseDouble(value.trim());
			return Double.isFinite(parsed) ? parsed : 0.0;
		} catch (NumberFormatException ex) {
			return 0.0;
		}
	}

	public static String decodeUtf8(byte[] payload) {
		String raw = new String(payload, StandardCharsets.UTF_8);
		return stripBom(raw);
	}
}
