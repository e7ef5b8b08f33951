package my.hrddrisk.app.catalog;

import my.hrddrisk.app.model.CountryRiskRecord;
import my.hrddrisk.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the eight-column country export: name, ISO code, the five risk factors and the base risk score.
 * The first row is a header and only its width is checked.
 */
public class CountryFileParser {
	static final int EXPECTED_COLUMN_COUNT = 8;

	private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
			.setIgnoreEmptyLines(true)
			.setIgnoreSurroundingSpaces(true)
			.setTrim(true)
			.build();

	public ParseResult parse(byte[] payload) {
		if (payload == null) {
			throw new IllegalArgumentException("Country data file is empty");
		}
		return parse(CsvParsing.decodeUtf8(payload));
	}

	public ParseResult parse(String content) {
		String sanitized = sanitize(content);
		if (sanitized.isBlank()) {
			throw new IllegalArgumentException("Country data file is empty");
		}

		Map<String, CountryRiskRecord> byIsoCode = new LinkedHashMap<>();
		List<DuplicateEntry> duplicates = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(new StringReader(sanitized), FORMAT)) {
			boolean header = true;
			for (CSVRecord record : parser) {
				long line = record.getRecordNumber();
				if (header) {
					if (record.size() != EXPECTED_COLUMN_COUNT) {
						throw new IllegalArgumentException("Unexpected number of columns in header. Expected "
								+ EXPECTED_COLUMN_COUNT + ", received " + record.size());
					}
					header = false;
					continue;
				}
				if (record.size() != EXPECTED_COLUMN_COUNT) {
					throw new IllegalArgumentException("Unexpected number of columns on line " + line
							+ ". Expected " + EXPECTED_COLUMN_COUNT + ", received " + record.size());
				}
				String isoCode = cell(record, 1);
				if (isoCode.isEmpty()) {
					throw new IllegalArgumentException("Missing ISO code on line " + line);
				}
				CountryRiskRecord country = new CountryRiskRecord(
						cell(record, 0),
						isoCode,
						number(record, 2),
						number(record, 3),
						number(record, 4),
						number(record, 5),
						number(record, 6),
						number(record, 7)
				);
				CountryRiskRecord replaced = byIsoCode.put(isoCode, country);
				if (replaced != null) {
					duplicates.add(new DuplicateEntry(isoCode, replaced.name(), country.name()));
				}
			}
		} catch (IOException | IllegalStateException ex) {
			throw new IllegalArgumentException("Failed to read country data: " + ex.getMessage(), ex);
		}
		return new ParseResult(List.copyOf(byIsoCode.values()), List.copyOf(duplicates));
	}

	// Whole lines exported as one quoted string are unwrapped before the CSV pass.
	private String sanitize(String content) {
		if (content == null) {
			return "";
		}
		String withoutNul = CsvParsing.stripBom(content).replace("\0", "");
		StringBuilder builder = new StringBuilder(withoutNul.length());
		for (String rawLine : withoutNul.split("\\r?\\n")) {
			String line = rawLine.trim();
			if (line.isEmpty()) {
				continue;
			}
			if (isWrappedLine(line)) {
				line = CsvParsing.stripWrappingQuotes(line);
			}
			builder.append(line).append('\n');
		}
		return builder.toString();
	}

	private boolean isWrappedLine(String line) {
		if (line.length() < 2 || !line.startsWith("\"") || !line.endsWith("\"")) {
			return false;
		}
		return line.chars().filter(ch -> ch == '"').count() == 2 && line.indexOf(',') > 0;
	}

	private String cell(CSVRecord record, int index) {
		String value = CsvParsing.stripWrappingQuotes(record.get(index));
		return value == null ? "" : value.trim();
	}

	private Double number(CSVRecord record, int index) {
		return CsvParsing.parseNumberOrZero(cell(record, index));
	}

	public record ParseResult(List<CountryRiskRecord> countries, List<DuplicateEntry> duplicates) {
	}

	/**
	 * A later row with an already seen ISO code. The later row is kept.
	 */
	public record DuplicateEntry(String isoCode, String replacedName, String keptName) {
	}
}
