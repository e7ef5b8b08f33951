package my.hrddrisk.app.model;

import java.util.Arrays;
import java.util.List;

public record CountryRiskRecord(
		String name,
		String isoCode,
		Double itucRightsRating,
		Double corruptionIndex,
		Double migrantWorkerPrevalence,
		Double wjpIndex,
		Double walkfreeSlaveryIndex,
		Double baseRiskScore
) {
	/**
	 * Factor values in {@link RiskFactor} order. Missing values stay {@code null}.
	 */
	public List<Double> factorValues() {
		return Arrays.asList(itucRightsRating, corruptionIndex, migrantWorkerPrevalence, wjpIndex, walkfreeSlaveryIndex);
	}

	public Double factorValue(RiskFactor factor) {
		return factorValues().get(factor.ordinal());
	}
}
