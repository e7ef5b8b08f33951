package my.hrddrisk.app.config;

import my.hrddrisk.app.catalog.CountryCatalog;
import my.hrddrisk.app.catalog.CountryFileParser;
import my.hrddrisk.app.catalog.FallbackCountryCatalog;
import my.hrddrisk.app.catalog.FileCountryCatalog;
import my.hrddrisk.app.catalog.JdbcCountryCatalog;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class CountryCatalogConfig {
	static final String DEFAULT_COUNTRY_FILE = "classpath:countries.csv";

	@Bean
	public CountryFileParser countryFileParser() {
		return new CountryFileParser();
	}

	@Bean
	public FileCountryCatalog fileCountryCatalog(ResourceLoader resourceLoader,
												 CountryFileParser countryFileParser,
												 AppProperties properties) {
		String location = properties.catalog() == null ? null : properties.catalog().countryFile();
		if (location == null || location.isBlank()) {
			location = DEFAULT_COUNTRY_FILE;
		}
		return new FileCountryCatalog(resourceLoader.getResource(location), countryFileParser);
	}

	@Bean
	@Primary
	public CountryCatalog countryCatalog(ObjectProvider<JdbcCountryCatalog> jdbcCountryCatalog,
										 FileCountryCatalog fileCountryCatalog) {
		return new FallbackCountryCatalog(jdbcCountryCatalog.getIfAvailable(), fileCountryCatalog);
	}
}
