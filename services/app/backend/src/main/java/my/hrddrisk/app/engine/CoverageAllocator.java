package my.hrddrisk.app.engine;

import my.hrddrisk.app.model.MonitoringTool;
import my.hrddrisk.app.model.RiskModelConstants;
import my.hrddrisk.app.util.ScoreMath;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spreads each tool's nominal coverage across the selected countries. Focus shifts coverage toward countries
 * with a high biased ratio, but the portfolio-wide usage of a tool may only grow by the conservation headroom.
 */
public class CoverageAllocator {
	static final double BOOST_MIN_FOCUS = 0.3;
	static final double BOOST_MIN_RISK = 40.0;
	static final double BOOST_FULL_RISK = 80.0;

	private final RiskModelConstants constants;

	public CoverageAllocator(RiskModelConstants constants) {
		this.constants = constants == null ? RiskModelConstants.DEFAULTS : constants;
	}

	/**
	 * @param baseCoverage clamped coverage percentages per tool, or {@code null} when the strategy vector was
	 *                     structurally invalid
	 */
	public CoverageAllocation allocate(List<CountryExposure> exposures, double[] baseCoverage, double focus) {
		if (exposures == null || exposures.isEmpty()) {
			return new CoverageAllocation(Map.of(), List.of());
		}
		double sanitizedFocus = ScoreMath.clampUnit(focus);
		if (baseCoverage == null) {
			Map<String, List<Double>> empty = new LinkedHashMap<>();
			for (CountryExposure exposure : exposures) {
				empty.put(exposure.isoCode(), Collections.nCopies(MonitoringTool.count(), 0.0));
			}
			return new CoverageAllocation(Collections.unmodifiableMap(empty), List.of());
		}

		double[] conservation = resourceConservationFactors(exposures, baseCoverage, sanitizedFocus);
		Map<String, List<Double>> coverageByCountry = new LinkedHashMap<>();
		for (CountryExposure exposure : exposures) {
			List<Double> coverage = new ArrayList<>(baseCoverage.length);
			for (int tool = 0; tool < baseCoverage.length; tool++) {
				double boosted = boostedCoverage(baseCoverage[tool], sanitizedFocus, exposure);
				coverage.add(ScoreMath.clamp(boosted * conservation[tool], 0.0, ScoreMath.MAX_PERCENT));
			}
			coverageByCountry.put(exposure.isoCode(), List.copyOf(coverage));
		}
		List<Double> factors = new ArrayList<>(conservation.length);
		for (double factor : conservation) {
			factors.add(factor);
		}
		return new CoverageAllocation(Collections.unmodifiableMap(coverageByCountry), List.copyOf(factors));
	}

	/**
	 * Per tool: scale-down factor applied when focus-adjusted usage exceeds the un-biased usage by more than
	 * {@code focus * conservationHeadroom}.
	 */
	public double[] resourceConservationFactors(List<CountryExposure> exposures, double[] baseCoverage, double focus) {
		double[] factors = new double[baseCoverage.length];
		Arrays.fill(factors, 1.0);
		double sanitizedFocus = ScoreMath.clampUnit(focus);
		double allowedGrowth = 1.0 + sanitizedFocus * constants.getConservationHeadroom();
		double volumeScale = ScoreMath.volumeScale(exposures.stream().mapToDouble(CountryExposure::volume).toArray());
		for (int tool = 0; tool < baseCoverage.length; tool++) {
			double expected = 0.0;
			double actual = 0.0;
			for (CountryExposure exposure : exposures) {
				double weight = exposure.volume() / volumeScale;
				expected += weight * baseCoverage[tool] / 100.0;
				double boosted = Math.min(ScoreMath.MAX_PERCENT, boostedCoverage(baseCoverage[tool], sanitizedFocus, exposure));
				actual += weight * boosted / 100.0;
			}
			double maxAllowed = expected * allowedGrowth;
			if (actual > maxAllowed && actual > 0) {
				factors[tool] = maxAllowed / actual;
			}
		}
		return factors;
	}

	double boostedCoverage(double baseCoverage, double focus, CountryExposure exposure) {
		double focusWeight = (1.0 - focus) + focus * exposure.biasedRatio();
		return baseCoverage * focusWeight * highRiskBoost(focus, exposure.risk());
	}

	/**
	 * Ramps linearly in both risk (40 to 80) and focus (0.3 to 1.0), so the boost starts at exactly 1 on the
	 * risk boundary.
	 */
	public double highRiskBoost(double focus, double countryRisk) {
		if (!(focus > BOOST_MIN_FOCUS) || !(countryRisk >= BOOST_MIN_RISK)) {
			return 1.0;
		}
		double riskProgress = ScoreMath.clampUnit((countryRisk - BOOST_MIN_RISK) / (BOOST_FULL_RISK - BOOST_MIN_RISK));
		double focusProgress = ScoreMath.clampUnit((focus - BOOST_MIN_FOCUS) / (1.0 - BOOST_MIN_FOCUS));
		return 1.0 + constants.getMaxHighRiskBoost() * riskProgress * focusProgress;
	}

	public record CoverageAllocation(Map<String, List<Double>> countryCoverage,
									 List<Double> conservationFactors) {
	}
}
