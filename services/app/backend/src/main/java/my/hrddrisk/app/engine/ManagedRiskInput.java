package my.hrddrisk.app.engine;

import java.util.List;
import java.util.Map;

/**
 * Inputs of one managed-risk evaluation. {@code null} vectors and focus fall back to the engine defaults; a
 * vector with the wrong number of entries is treated as invalid and zeroes its sub-result.
 */
public record ManagedRiskInput(List<String> selectedCountries,
							   Map<String, Double> countryVolumes,
							   Map<String, Double> countryRisks,
							   List<Double> coverage,
							   List<Double> transparencyEffectiveness,
							   List<Double> responsivenessStrategy,
							   List<Double> responsivenessEffectiveness,
							   Double focus) {
	public static ManagedRiskInput withDefaultStrategy(List<String> selectedCountries,
													   Map<String, Double> countryVolumes,
													   Map<String, Double> countryRisks,
													   Double focus) {
		return new ManagedRiskInput(selectedCountries, countryVolumes, countryRisks, null, null, null, null, focus);
	}
}
