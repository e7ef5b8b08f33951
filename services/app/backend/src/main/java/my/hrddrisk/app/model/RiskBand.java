package my.hrddrisk.app.model;

import java.util.ArrayList;
import java.util.List;

public enum RiskBand {
	LOW("Low", 0.0, 20.0, "#22c55e"),
	MEDIUM("Medium", 20.0, 40.0, "#eab308"),
	MEDIUM_HIGH("Medium High", 40.0, 60.0, "#f97316"),
	HIGH("High", 60.0, 80.0, "#ef4444"),
	VERY_HIGH("Very High", 80.0, Double.POSITIVE_INFINITY, "#991b1b");

	private final String displayName;
	private final double min;
	private final double maxExclusive;
	private final String color;

	RiskBand(String displayName, double min, double maxExclusive, String color) {
		this.displayName = displayName;
		this.min = min;
		this.maxExclusive = maxExclusive;
		this.color = color;
	}

	public String getDisplayName() {
		return displayName;
	}

	public double getMin() {
		return min;
	}

	public double getMaxExclusive() {
		return maxExclusive;
	}

	public String getColor() {
		return color;
	}

	/**
	 * Negative and non-finite scores fall into {@link #LOW}.
	 */
	public static RiskBand forScore(double score) {
		double resolved = Double.isFinite(score) ? Math.max(0.0, score) : 0.0;
		for (RiskBand band : values()) {
			if (resolved >= band.min && resolved < band.maxExclusive) {
				return band;
			}
		}
		return VERY_HIGH;
	}

	public static List<BandDefinition> definitions() {
		List<BandDefinition> definitions = new ArrayList<>();
		for (RiskBand band : values()) {
			String upper = band == VERY_HIGH ? "100" : String.valueOf((int) band.maxExclusive - 1);
			definitions.add(new BandDefinition(band.displayName, (int) band.min + "-" + upper, band.color));
		}
		return List.copyOf(definitions);
	}

	public record BandDefinition(String name, String range, String color) {
	}
}
