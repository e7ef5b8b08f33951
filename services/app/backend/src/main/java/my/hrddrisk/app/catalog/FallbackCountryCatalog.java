package my.hrddrisk.app.catalog;

import my.hrddrisk.app.model.CountryRiskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Reads from the primary catalog and switches to the fallback when the primary is unavailable or empty.
 */
public class FallbackCountryCatalog implements CountryCatalog {
	private static final Logger logger = LoggerFactory.getLogger(FallbackCountryCatalog.class);

	private final CountryCatalog primary;
	private final CountryCatalog fallback;

	public FallbackCountryCatalog(CountryCatalog primary, CountryCatalog fallback) {
		this.primary = primary;
		this.fallback = fallback;
	}

	@Override
	public List<CountryRiskRecord> findAll() {
		if (primary != null) {
			try {
				List<CountryRiskRecord> countries = primary.findAll();
				if (countries != null && !countries.isEmpty()) {
					return countries;
				}
				logger.warn("Country catalog {} is empty, using {}", primary.sourceName(), fallback.sourceName());
			} catch (CountryCatalogUnavailableException ex) {
				logger.warn("Country catalog {} unavailable, using {}: {}", primary.sourceName(),
						fallback.sourceName(), ex.getMessage());
			}
		}
		return fallback.findAll();
	}

	@Override
	public Optional<CountryRiskRecord> findByIsoCode(String isoCode) {
		if (primary != null) {
			try {
				Optional<CountryRiskRecord> country = primary.findByIsoCode(isoCode);
				if (country.isPresent()) {
					return country;
				}
			} catch (CountryCatalogUnavailableException ex) {
				logger.warn("Country catalog {} unavailable for {}, using {}: {}", primary.sourceName(), isoCode,
						fallback.sourceName(), ex.getMessage());
			}
		}
		return fallback.findByIsoCode(isoCode);
	}

	@Override
	public String sourceName() {
		String primaryName = primary == null ? "none" : primary.sourceName();
		return primaryName + " -> " + fallback.sourceName();
	}
}
