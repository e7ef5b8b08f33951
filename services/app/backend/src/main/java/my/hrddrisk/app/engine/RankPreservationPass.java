package my.hrddrisk.app.engine;

import my.hrddrisk.app.model.RiskModelConstants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Repairs rank inversions left by the bias, cap and floor stages. Walks countries from highest to lowest
 * baseline risk and keeps each managed value strictly below its predecessor, never below the residual floor.
 * The fold carries the previous corrected value and must run sequentially.
 */
public class RankPreservationPass {
	private static final Comparator<RankEntry> BASELINE_DESCENDING = Comparator
			.comparingDouble(RankEntry::baselineRisk).reversed()
			.thenComparing(RankEntry::isoCode);

	private final RiskModelConstants constants;

	public RankPreservationPass(RiskModelConstants constants) {
		this.constants = constants == null ? RiskModelConstants.DEFAULTS : constants;
	}

	public RankResult apply(List<RankEntry> entries) {
		if (entries == null || entries.isEmpty()) {
			return new RankResult(Map.of(), List.of());
		}
		List<RankEntry> ordered = new ArrayList<>(entries);
		ordered.sort(BASELINE_DESCENDING);

		Map<String, Double> corrected = new LinkedHashMap<>();
		List<RankAdjustment> adjustments = new ArrayList<>();
		RankEntry previousEntry = null;
		double previousManaged = 0.0;
		for (RankEntry entry : ordered) {
			double managed = entry.managedRisk();
			if (previousEntry != null && managed >= previousManaged) {
				double floor = entry.baselineRisk() * constants.getResidualFloor();
				double repaired = Math.max(floor, previousManaged - constants.getRankGap());
				adjustments.add(new RankAdjustment(entry.isoCode(), managed, repaired, previousEntry.isoCode()));
				managed = repaired;
			}
			corrected.put(entry.isoCode(), managed);
			previousEntry = entry;
			previousManaged = managed;
		}
		return new RankResult(Collections.unmodifiableMap(corrected), List.copyOf(adjustments));
	}

	public record RankEntry(String isoCode, double baselineRisk, double managedRisk) {
	}

	public record RankAdjustment(String isoCode,
								 double originalManagedRisk,
								 double correctedManagedRisk,
								 String constrainedBy) {
	}

	/**
	 * @param correctedRisks corrected managed risk per country, in descending baseline order
	 */
	public record RankResult(Map<String, Double> correctedRisks, List<RankAdjustment> adjustments) {
	}
}
