package my.hrddrisk.app.engine;

public record PortfolioMetrics(double baselineRisk,
							   double totalVolume,
							   double weightedRisk,
							   double weightedRiskSquares,
							   double riskConcentration) {
	public static PortfolioMetrics empty() {
		return new PortfolioMetrics(0.0, 0.0, 0.0, 0.0, 1.0);
	}
}
