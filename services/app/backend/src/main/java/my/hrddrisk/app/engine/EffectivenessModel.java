package my.hrddrisk.app.engine;

import my.hrddrisk.app.model.MonitoringTool;
import my.hrddrisk.app.model.ResponseLever;
import my.hrddrisk.app.model.RiskModelConstants;
import my.hrddrisk.app.model.ToolCategory;
import my.hrddrisk.app.util.ScoreMath;

import java.util.List;

public class EffectivenessModel {
	private final RiskModelConstants constants;

	public EffectivenessModel(RiskModelConstants constants) {
		this.constants = constants == null ? RiskModelConstants.DEFAULTS : constants;
	}

	public double transparencyEffectiveness(List<Double> coverage, List<Double> effectiveness) {
		double[] coverageValues = ScoreMath.toPercentArray(coverage, MonitoringTool.count());
		double[] effectivenessValues = ScoreMath.toPercentArray(effectiveness, MonitoringTool.count());
		return transparency(coverageValues, effectivenessValues);
	}

	/**
	 * Detection probability of the tool mix: tools within a category combine as independent detections, then
	 * the weighted categories combine the same way. Capped so residual risk always remains.
	 *
	 * @param coveragePct      clamped coverage per tool in [0, 100]
	 * @param effectivenessPct clamped user effectiveness per tool in [0, 100]
	 */
	public double transparency(double[] coveragePct, double[] effectivenessPct) {
		if (coveragePct == null || effectivenessPct == null
				|| coveragePct.length != MonitoringTool.count()
				|| effectivenessPct.length != MonitoringTool.count()) {
			return 0.0;
		}
		double combined = 0.0;
		for (ToolCategory category : ToolCategory.values()) {
			double missProbability = 1.0;
			for (MonitoringTool tool : MonitoringTool.ofCategory(category)) {
				int index = tool.ordinal();
				double coverage = ScoreMath.clamp(coveragePct[index], 0.0, ScoreMath.MAX_PERCENT) / 100.0;
				double effectiveRate = effectiveRate(tool, effectivenessPct[index]);
				missProbability *= 1.0 - coverage * effectiveRate;
			}
			double categoryTransparency = 1.0 - missProbability;
			combined = 1.0 - (1.0 - combined) * (1.0 - categoryTransparency * category.getCategoryWeight());
		}
		return Math.min(combined, constants.getTransparencyCap());
	}

	public double effectiveRate(MonitoringTool tool, double userEffectivenessPct) {
		double user = ScoreMath.clamp(userEffectivenessPct, 0.0, ScoreMath.MAX_PERCENT) / 100.0;
		return (tool.getBaseEffectiveness() + user) / 2.0;
	}

	/**
	 * Weighted mean of lever effectiveness. No diminishing returns.
	 */
	public double responsivenessEffectiveness(List<Double> strategy, List<Double> effectiveness) {
		int levers = ResponseLever.count();
		if (strategy == null || effectiveness == null || strategy.size() != levers || effectiveness.size() != levers) {
			return 0.0;
		}
		double weighted = 0.0;
		double totalWeight = 0.0;
		for (int i = 0; i < levers; i++) {
			double weight = ScoreMath.clampPercent(strategy.get(i));
			double rate = ScoreMath.clampPercent(effectiveness.get(i)) / 100.0;
			weighted += weight * rate;
			totalWeight += weight;
		}
		return totalWeight > 0 ? weighted / totalWeight : 0.0;
	}

	/**
	 * Ceiling on the share of a country's risk that can be removed: 70% at risk 0 down to 50% at risk 100.
	 */
	public double effectivenessCap(double countryRisk) {
		double normalizedRisk = ScoreMath.clamp(countryRisk, 0.0, ScoreMath.MAX_PERCENT) / 100.0;
		return constants.getEffectivenessCapBase() + constants.getEffectivenessCapRange() * (1.0 - normalizedRisk);
	}

	public ManagedOutcome managedOutcome(double countryRisk,
										 double transparency,
										 double responsiveness,
										 double countryFocusMultiplier) {
		double risk = Math.max(0.0, ScoreMath.finiteOrZero(countryRisk));
		double reductionFactor = ScoreMath.finiteOrZero(transparency * responsiveness * countryFocusMultiplier);
		double cap = effectivenessCap(risk);
		double cappedFactor = ScoreMath.clamp(reductionFactor, 0.0, cap);
		double floor = risk * constants.getResidualFloor();
		double managed = Math.max(risk * (1.0 - cappedFactor), floor);
		return new ManagedOutcome(reductionFactor, cap, cappedFactor, managed);
	}

	public record ManagedOutcome(double reductionFactor,
								 double effectivenessCap,
								 double cappedFactor,
								 double managedRisk) {
	}
}
