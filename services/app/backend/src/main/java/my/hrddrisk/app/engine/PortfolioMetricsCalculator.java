package my.hrddrisk.app.engine;

import my.hrddrisk.app.util.ScoreMath;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class PortfolioMetricsCalculator {
	private final double defaultVolume;

	public PortfolioMetricsCalculator(double defaultVolume) {
		this.defaultVolume = Math.max(0.0, ScoreMath.finiteOrZero(defaultVolume));
	}

	public PortfolioMetrics calculate(Collection<String> selection,
									  Map<String, Double> volumes,
									  Map<String, Double> risks) {
		List<String> codes = distinctCodes(selection);
		if (codes.isEmpty()) {
			return PortfolioMetrics.empty();
		}
		double[] resolvedVolumes = new double[codes.size()];
		double[] resolvedRisks = new double[codes.size()];
		for (int i = 0; i < codes.size(); i++) {
			resolvedVolumes[i] = resolveVolume(volumes, codes.get(i));
			resolvedRisks[i] = resolveRisk(risks, codes.get(i));
		}
		double scale = ScoreMath.volumeScale(resolvedVolumes);
		double totalVolumeRisk = 0.0;
		double totalVolume = 0.0;
		double scaledVolumeRisk = 0.0;
		double scaledVolume = 0.0;
		for (int i = 0; i < codes.size(); i++) {
			double scaled = resolvedVolumes[i] / scale;
			totalVolumeRisk += resolvedVolumes[i] * resolvedRisks[i];
			totalVolume += resolvedVolumes[i];
			scaledVolumeRisk += scaled * resolvedRisks[i];
			scaledVolume += scaled;
		}
		if (scaledVolume <= 0) {
			return new PortfolioMetrics(0.0, 0.0, totalVolumeRisk, 0.0, 1.0);
		}
		double baselineRisk = scaledVolumeRisk / scaledVolume;

		double weightedRiskSquares = 0.0;
		for (int i = 0; i < codes.size(); i++) {
			double share = resolvedVolumes[i] / scale / scaledVolume;
			weightedRiskSquares += share * resolvedRisks[i] * resolvedRisks[i];
		}
		double riskConcentration = baselineRisk > 0 && weightedRiskSquares > 0
				? Math.max(1.0, weightedRiskSquares / (baselineRisk * baselineRisk))
				: 1.0;
		return new PortfolioMetrics(baselineRisk, totalVolume, totalVolumeRisk, weightedRiskSquares, riskConcentration);
	}

	public double resolveVolume(Map<String, Double> volumes, String code) {
		Double raw = volumes == null ? null : volumes.get(code);
		if (raw == null || !Double.isFinite(raw)) {
			return defaultVolume;
		}
		return Math.max(0.0, raw);
	}

	public double resolveRisk(Map<String, Double> risks, String code) {
		Double raw = risks == null ? null : risks.get(code);
		return Math.max(0.0, ScoreMath.finiteOrZero(raw));
	}

	/**
	 * Selection order is kept; blanks and repeated codes are dropped.
	 */
	public static List<String> distinctCodes(Collection<String> selection) {
		if (selection == null || selection.isEmpty()) {
			return List.of();
		}
		Set<String> codes = new LinkedHashSet<>();
		for (String code : selection) {
			if (code != null && !code.isBlank()) {
				codes.add(code);
			}
		}
		return List.copyOf(new ArrayList<>(codes));
	}
}
