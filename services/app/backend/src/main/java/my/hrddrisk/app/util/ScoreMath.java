package my.hrddrisk.app.util;

import java.util.List;

public final class ScoreMath {
	public static final double MAX_PERCENT = 100.0;

	private ScoreMath() {
	}

	public static double finiteOrZero(Double value) {
		return finiteOr(value, 0.0);
	}

	public static double finiteOr(Double value, double fallback) {
		if (value == null || !Double.isFinite(value)) {
			return fallback;
		}
		return value;
	}

	/**
	 * NaN resolves to {@code min}.
	 */
	public static double clamp(double value, double min, double max) {
		if (Double.isNaN(value) || value < min) {
			return min;
		}
		if (value > max) {
			return max;
		}
		return value;
	}

	public static double clampUnit(double value) {
		return clamp(value, 0.0, 1.0);
	}

	public static double clampPercent(Double value) {
		return clamp(finiteOrZero(value), 0.0, MAX_PERCENT);
	}

	public static double sanitizeFocus(Double focus, double fallback) {
		if (focus == null) {
			return clampUnit(fallback);
		}
		return clampUnit(finiteOrZero(focus));
	}

	/**
	 * Largest finite positive volume, or 1 when there is none. Volume-weighted means are taken over
	 * {@code volume / scale} so that sums stay finite for very large volumes.
	 */
	public static double volumeScale(double[] volumes) {
		double largest = 0.0;
		if (volumes != null) {
			for (double volume : volumes) {
				if (Double.isFinite(volume) && volume > largest) {
					largest = volume;
				}
			}
		}
		return largest > 0 ? largest : 1.0;
	}

	/**
	 * Converts a percentage vector to a clamped array. Returns {@code null} when the vector is missing or does not
	 * have exactly {@code expectedLength} entries; callers treat that as a zero sub-result.
	 */
	public static double[] toPercentArray(List<Double> values, int expectedLength) {
		if (values == null || values.size() != expectedLength) {
			return null;
		}
		double[] result = new double[expectedLength];
		for (int i = 0; i < expectedLength; i++) {
			result[i] = clampPercent(values.get(i));
		}
		return result;
	}
}
