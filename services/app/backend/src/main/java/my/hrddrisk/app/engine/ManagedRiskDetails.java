package my.hrddrisk.app.engine;

import java.util.List;
import java.util.Map;

public record ManagedRiskDetails(double managedRisk,
								 double baselineRisk,
								 double riskConcentration,
								 double portfolioFocusMultiplier,
								 double combinedEffectiveness,
								 Map<String, Double> countryManagedRisks,
								 Map<String, List<Double>> countryCoverage,
								 FocusEffectivenessMetrics focusEffectivenessMetrics,
								 List<CountryDetail> countryDetails,
								 List<RankPreservationPass.RankAdjustment> rankAdjustments) {

	public record FocusEffectivenessMetrics(double focus,
											double focusExponent,
											double portfolioFocusMultiplier,
											double uniformTransparency,
											double focusedTransparency,
											double transparencyGain,
											double responsivenessEffectiveness,
											double averageCountryFocusMultiplier,
											List<Double> conservationFactors,
											int rankAdjustmentCount) {
	}

	/**
	 * Per-country trace. {@code uncorrectedManagedRisk} is the value before rank repair; {@code managedRisk}
	 * is the published one.
	 */
	public record CountryDetail(String isoCode,
								double volume,
								double baselineRisk,
								double biasedRiskRatio,
								double focusMultiplier,
								double transparencyEffectiveness,
								double reductionFactor,
								double effectivenessCap,
								double uncorrectedManagedRisk,
								double managedRisk) {
	}
}
