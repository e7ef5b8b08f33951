package my.hrddrisk.app.engine;

import java.util.List;

public record StrategyBreakdown(List<ToolContribution> monitoringTools,
								List<LeverContribution> responseLevers,
								double overallTransparency,
								double overallResponsiveness,
								PrimaryResponse primaryResponse,
								FocusSummary focus) {

	/**
	 * Effectiveness values are whole percentages; contribution is coverage times the averaged rate.
	 */
	public record ToolContribution(String name,
								   String category,
								   double coverage,
								   long baseEffectiveness,
								   double userEffectiveness,
								   long averageEffectiveness,
								   double contribution) {
	}

	public record LeverContribution(String name, double weight, double effectiveness, double weightShare) {
	}

	public record PrimaryResponse(String method, double weight, double effectiveness) {
	}

	public record FocusSummary(double level, double concentration, double portfolioMultiplier) {
	}
}
