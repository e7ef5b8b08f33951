package my.hrddrisk.app.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class RiskModelConstants {
	public static final RiskModelConstants DEFAULTS = new RiskModelConstants(
			2.75,
			0.08,
			2.5,
			1.4,
			2.0,
			0.3,
			0.3,
			0.90,
			0.50,
			0.20,
			0.25,
			0.5
	);

	private final double focusGamma;
	private final double minRiskRatio;
	private final double maxRiskRatio;
	private final double midpointExponent;
	private final double maxExponent;
	private final double conservationHeadroom;
	private final double maxHighRiskBoost;
	private final double transparencyCap;
	private final double effectivenessCapBase;
	private final double effectivenessCapRange;
	private final double residualFloor;
	private final double rankGap;
}
