package my.hrddrisk.app.config;

import my.hrddrisk.app.catalog.CountryCatalogUnavailableException;
import my.hrddrisk.app.catalog.CountryFileParser;
import my.hrddrisk.app.catalog.FileCountryCatalog;
import my.hrddrisk.app.catalog.JdbcCountryCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Imports the bundled country file into an empty country table on startup.
 */
@Component
public class CountrySeeder implements ApplicationRunner {
	private static final Logger logger = LoggerFactory.getLogger(CountrySeeder.class);

	private final ObjectProvider<JdbcCountryCatalog> jdbcCountryCatalog;
	private final FileCountryCatalog fileCountryCatalog;
	private final AppProperties properties;

	public CountrySeeder(ObjectProvider<JdbcCountryCatalog> jdbcCountryCatalog,
						 FileCountryCatalog fileCountryCatalog,
						 AppProperties properties) {
		this.jdbcCountryCatalog = jdbcCountryCatalog;
		this.fileCountryCatalog = fileCountryCatalog;
		this.properties = properties;
	}

	@Override
	public void run(ApplicationArguments args) {
		if (properties.catalog() == null || !properties.catalog().seedOnStartup()) {
			return;
		}
		JdbcCountryCatalog store = jdbcCountryCatalog.getIfAvailable();
		if (store == null) {
			logger.info("Country seeding skipped, no database catalog configured");
			return;
		}
		try {
			if (store.count() > 0) {
				return;
			}
			CountryFileParser.ParseResult result = fileCountryCatalog.load();
			int imported = store.replaceAll(result.countries());
			logger.info("Seeded {} countries from {} ({} duplicate ISO codes replaced)",
					imported, fileCountryCatalog.sourceName(), result.duplicates().size());
		} catch (CountryCatalogUnavailableException | IllegalArgumentException ex) {
			logger.error("Failed to seed countries from {}: {}", fileCountryCatalog.sourceName(), ex.getMessage());
		}
	}
}
