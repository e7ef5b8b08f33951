package my.hrddrisk.app.catalog;

import my.hrddrisk.app.model.CountryRiskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;

/**
 * Country records read once from a CSV resource and kept in memory afterwards.
 */
public class FileCountryCatalog implements CountryCatalog {
	private static final Logger logger = LoggerFactory.getLogger(FileCountryCatalog.class);

	private final Resource resource;
	private final CountryFileParser parser;
	private volatile List<CountryRiskRecord> cached;

	public FileCountryCatalog(Resource resource, CountryFileParser parser) {
		this.resource = resource;
		this.parser = parser == null ? new CountryFileParser() : parser;
	}

	@Override
	public List<CountryRiskRecord> findAll() {
		List<CountryRiskRecord> current = cached;
		if (current == null) {
			synchronized (this) {
				current = cached;
				if (current == null) {
					current = load().countries();
					cached = current;
				}
			}
		}
		return current;
	}

	@Override
	public Optional<CountryRiskRecord> findByIsoCode(String isoCode) {
		if (isoCode == null || isoCode.isBlank()) {
			return Optional.empty();
		}
		String code = isoCode.trim();
		return findAll().stream()
				.filter(country -> code.equals(country.isoCode()))
				.findFirst();
	}

	@Override
	public String sourceName() {
		return resource == null ? "file" : "file:" + resource.getFilename();
	}

	/**
	 * Parses the resource without touching the cache. Used by the seeder, which also wants the duplicate report.
	 */
	public CountryFileParser.ParseResult load() {
		if (resource == null || !resource.exists()) {
			throw new CountryCatalogUnavailableException("Country data file not found: " + sourceName());
		}
		try (InputStream inputStream = resource.getInputStream()) {
			CountryFileParser.ParseResult result = parser.parse(inputStream.readAllBytes());
			if (!result.duplicates().isEmpty()) {
				logger.warn("Duplicate ISO codes in {}, keeping last occurrence: {}", sourceName(), result.duplicates());
			}
			return result;
		} catch (IOException ex) {
			throw new CountryCatalogUnavailableException("Country data file could not be read: " + sourceName(), ex);
		}
	}
}
