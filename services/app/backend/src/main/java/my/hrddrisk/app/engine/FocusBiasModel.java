package my.hrddrisk.app.engine;

import my.hrddrisk.app.model.RiskModelConstants;
import my.hrddrisk.app.util.ScoreMath;

/**
 * Turns the focus preference into the exponent, ratio and multiplier curves that skew effort toward
 * higher-risk countries.
 */
public class FocusBiasModel {
	static final double MIN_EXPONENT = 1.0;
	static final double FOCUS_MIDPOINT = 0.5;
	static final double LOW_RATIO_DAMPER_FOCUS = 0.6;
	static final double LOW_RATIO_THRESHOLD = 0.8;
	static final double LOW_RATIO_MAX_COMPRESSION = 0.5;
	static final double HIGH_RATIO_DAMPER_FOCUS = 0.7;
	static final double HIGH_RATIO_THRESHOLD = 1.5;
	static final double HIGH_RISK_BONUS_FOCUS = 0.6;
	static final double HIGH_RISK_BONUS_MIN_RISK = 70.0;
	static final double HIGH_RISK_BONUS_RATE = 0.5;

	private final RiskModelConstants constants;

	public FocusBiasModel(RiskModelConstants constants) {
		this.constants = constants == null ? RiskModelConstants.DEFAULTS : constants;
	}

	/**
	 * Quadratic ramp up to the midpoint exponent at focus 0.5, then a 1.5-power curve toward the maximum.
	 * Continuous and non-decreasing over [0, 1].
	 */
	public double focusExponent(double focus) {
		double sanitized = ScoreMath.clampUnit(focus);
		double midpoint = constants.getMidpointExponent();
		double max = constants.getMaxExponent();
		double exponent;
		if (sanitized <= FOCUS_MIDPOINT) {
			double progress = sanitized / FOCUS_MIDPOINT;
			exponent = MIN_EXPONENT + (midpoint - MIN_EXPONENT) * progress * progress;
		} else {
			double progress = (sanitized - FOCUS_MIDPOINT) / (1.0 - FOCUS_MIDPOINT);
			exponent = midpoint + (max - midpoint) * Math.pow(progress, 1.5);
		}
		return ScoreMath.clamp(exponent, MIN_EXPONENT, max);
	}

	public double biasedRiskRatio(double rawRatio, double focus, double countryRisk, double baselineRisk) {
		if (!(baselineRisk > 0)) {
			return 1.0;
		}
		double sanitizedFocus = ScoreMath.clampUnit(focus);
		double ratio = Double.isFinite(rawRatio) ? rawRatio : ScoreMath.finiteOrZero(countryRisk) / baselineRisk;
		double min = constants.getMinRiskRatio();
		double max = constants.getMaxRiskRatio();
		double clampedRaw = ScoreMath.clamp(ratio, min, max);

		double biased = ScoreMath.clamp(Math.pow(clampedRaw, focusExponent(sanitizedFocus)), min, max);

		if (sanitizedFocus > LOW_RATIO_DAMPER_FOCUS && clampedRaw < LOW_RATIO_THRESHOLD) {
			double strength = (sanitizedFocus - LOW_RATIO_DAMPER_FOCUS) / (1.0 - LOW_RATIO_DAMPER_FOCUS);
			double gap = 1.0 - clampedRaw / LOW_RATIO_THRESHOLD;
			biased *= 1.0 - LOW_RATIO_MAX_COMPRESSION * strength * gap * gap;
		}
		if (sanitizedFocus > HIGH_RATIO_DAMPER_FOCUS && biased > HIGH_RATIO_THRESHOLD) {
			double excess = biased - HIGH_RATIO_THRESHOLD;
			biased = HIGH_RATIO_THRESHOLD + (Math.sqrt(1.0 + excess) - 1.0);
		}
		return ScoreMath.clamp(biased, min, max);
	}

	public double portfolioFocusMultiplier(double focus, double riskConcentration) {
		double sanitizedFocus = ScoreMath.clampUnit(focus);
		double concentration = Double.isFinite(riskConcentration) && riskConcentration > 0
				? Math.max(1.0, riskConcentration)
				: 1.0;
		double gamma = constants.getFocusGamma();
		return (1.0 - sanitizedFocus * gamma) + sanitizedFocus * gamma * concentration;
	}

	/**
	 * High-risk countries under strong focus take the portfolio multiplier with a bonus instead of the ratio term.
	 */
	public double countryFocusMultiplier(double focus, double portfolioMultiplier, double biasedRatio, double countryRisk) {
		double sanitizedFocus = ScoreMath.clampUnit(focus);
		if (sanitizedFocus > HIGH_RISK_BONUS_FOCUS && countryRisk >= HIGH_RISK_BONUS_MIN_RISK) {
			return portfolioMultiplier * (1.0 + (sanitizedFocus - HIGH_RISK_BONUS_FOCUS) * HIGH_RISK_BONUS_RATE);
		}
		double gamma = constants.getFocusGamma();
		return (1.0 - sanitizedFocus * gamma) + sanitizedFocus * gamma * ScoreMath.finiteOrZero(biasedRatio);
	}
}
