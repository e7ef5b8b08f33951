package my.hrddrisk.app.engine;

import my.hrddrisk.app.model.RiskBand;

public record RiskSummary(ScoreBand baseline,
						  ScoreBand managed,
						  Improvement improvement,
						  PortfolioOverview portfolio,
						  StrategyBreakdown strategy) {

	public record ScoreBand(double score, RiskBand band, String color) {
		public static ScoreBand of(double score) {
			RiskBand band = RiskBand.forScore(score);
			return new ScoreBand(score, band, band.getColor());
		}
	}

	public record Improvement(double riskReduction, double absoluteReduction, boolean improvement) {
	}

	public record PortfolioOverview(int countriesSelected, double averageRisk, double riskConcentration) {
	}
}
