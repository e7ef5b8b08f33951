package my.hrddrisk.app.model;

import java.util.List;

/**
 * Immutable engine configuration. A reconfiguration builds a new instance; fields are never updated in place.
 */
public record RiskEngineConfig(
		List<Double> defaultWeights,
		List<Double> defaultCoverage,
		List<Double> defaultTransparencyEffectiveness,
		List<Double> defaultResponsivenessStrategy,
		List<Double> defaultResponsivenessEffectiveness,
		double defaultFocus,
		double defaultVolume,
		RiskModelConstants constants
) {
	public static final List<Double> DEFAULT_WEIGHTS = List.of(20.0, 20.0, 5.0, 10.0, 10.0);
	public static final List<Double> DEFAULT_COVERAGE = List.of(5.0, 15.0, 25.0, 60.0, 80.0, 90.0);
	public static final List<Double> DEFAULT_TRANSPARENCY_EFFECTIVENESS = List.of(90.0, 45.0, 25.0, 15.0, 12.0, 5.0);
	public static final List<Double> DEFAULT_RESPONSIVENESS_STRATEGY = List.of(10.0, 5.0, 20.0, 20.0, 10.0, 5.0);
	public static final List<Double> DEFAULT_RESPONSIVENESS_EFFECTIVENESS = List.of(70.0, 85.0, 35.0, 25.0, 15.0, 5.0);
	public static final double DEFAULT_FOCUS = 0.6;
	public static final double DEFAULT_VOLUME = 10.0;

	public RiskEngineConfig {
		defaultWeights = List.copyOf(defaultWeights);
		defaultCoverage = List.copyOf(defaultCoverage);
		defaultTransparencyEffectiveness = List.copyOf(defaultTransparencyEffectiveness);
		defaultResponsivenessStrategy = List.copyOf(defaultResponsivenessStrategy);
		defaultResponsivenessEffectiveness = List.copyOf(defaultResponsivenessEffectiveness);
		if (constants == null) {
			constants = RiskModelConstants.DEFAULTS;
		}
	}

	public static RiskEngineConfig defaults() {
		return new RiskEngineConfig(
				DEFAULT_WEIGHTS,
				DEFAULT_COVERAGE,
				DEFAULT_TRANSPARENCY_EFFECTIVENESS,
				DEFAULT_RESPONSIVENESS_STRATEGY,
				DEFAULT_RESPONSIVENESS_EFFECTIVENESS,
				DEFAULT_FOCUS,
				DEFAULT_VOLUME,
				RiskModelConstants.DEFAULTS
		);
	}
}
