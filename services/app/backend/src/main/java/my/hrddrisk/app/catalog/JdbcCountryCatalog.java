package my.hrddrisk.app.catalog;

import my.hrddrisk.app.model.CountryRiskRecord;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Country records stored in the {@code country} table, one row per ISO code.
 */
public class JdbcCountryCatalog implements CountryCatalog {
	private static final String SELECT_COLUMNS = """
			select iso_code, name, ituc_rights_rating, corruption_index, migrant_worker_prevalence,
			       wjp_index, walkfree_slavery_index, base_risk_score
			from country
			""";
	private static final RowMapper<CountryRiskRecord> ROW_MAPPER = (rs, rowNum) -> new CountryRiskRecord(
			rs.getString("name"),
			rs.getString("iso_code"),
			nullableDouble(rs, "ituc_rights_rating"),
			nullableDouble(rs, "corruption_index"),
			nullableDouble(rs, "migrant_worker_prevalence"),
			nullableDouble(rs, "wjp_index"),
			nullableDouble(rs, "walkfree_slavery_index"),
			nullableDouble(rs, "base_risk_score")
	);

	private final JdbcTemplate jdbcTemplate;

	public JdbcCountryCatalog(JdbcTemplate jdbcTemplate) {
		this.jdbcTemplate = jdbcTemplate;
	}

	@Override
	public List<CountryRiskRecord> findAll() {
		try {
			return jdbcTemplate.query(SELECT_COLUMNS + "order by name, iso_code", ROW_MAPPER);
		} catch (DataAccessException ex) {
			throw new CountryCatalogUnavailableException("Country table could not be read", ex);
		}
	}

	@Override
	public Optional<CountryRiskRecord> findByIsoCode(String isoCode) {
		if (isoCode == null || isoCode.isBlank()) {
			return Optional.empty();
		}
		try {
			List<CountryRiskRecord> rows = jdbcTemplate.query(SELECT_COLUMNS + "where iso_code = ?", ROW_MAPPER,
					isoCode.trim());
			return rows.stream().findFirst();
		} catch (DataAccessException ex) {
			throw new CountryCatalogUnavailableException("Country " + isoCode + " could not be read", ex);
		}
	}

	@Override
	public String sourceName() {
		return "database";
	}

	public long count() {
		try {
			Long count = jdbcTemplate.queryForObject("select count(*) from country", Long.class);
			return count == null ? 0L : count;
		} catch (DataAccessException ex) {
			throw new CountryCatalogUnavailableException("Country table could not be counted", ex);
		}
	}

	/**
	 * Replaces the whole table with the given records in one transaction.
	 *
	 * @return number of inserted rows
	 */
	@Transactional
	public int replaceAll(List<CountryRiskRecord> countries) {
		List<Object[]> rows = new ArrayList<>();
		if (countries != null) {
			for (CountryRiskRecord country : countries) {
				rows.add(new Object[]{
						country.isoCode(),
						country.name(),
						country.itucRightsRating(),
						country.corruptionIndex(),
						country.migrantWorkerPrevalence(),
						country.wjpIndex(),
						country.walkfreeSlaveryIndex(),
						country.baseRiskScore()
				});
			}
		}
		try {
			jdbcTemplate.update("delete from country");
			if (rows.isEmpty()) {
				return 0;
			}
			jdbcTemplate.batchUpdate("""
					insert into country (iso_code, name, ituc_rights_rating, corruption_index, migrant_worker_prevalence,
					                     wjp_index, walkfree_slavery_index, base_risk_score)
					values (?, ?, ?, ?, ?, ?, ?, ?)
					""", rows);
			return rows.size();
		} catch (DataAccessException ex) {
			throw new CountryCatalogUnavailableException("Country table could not be replaced", ex);
		}
	}

	private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
		double value = rs.getDouble(column);
		return rs.wasNull() ? null : value;
	}
}
