package my.hrddrisk.app.catalog;

import my.hrddrisk.app.model.CountryRiskRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read access to country risk records. Implementations throw {@link CountryCatalogUnavailableException} when
 * their backing store cannot be read.
 */
public interface CountryCatalog {
	List<CountryRiskRecord> findAll();

	Optional<CountryRiskRecord> findByIsoCode(String isoCode);

	String sourceName();
}
