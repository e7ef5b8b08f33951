package my.hrddrisk.app.engine;

import my.hrddrisk.app.model.CountryRiskRecord;
import my.hrddrisk.app.model.MonitoringTool;
import my.hrddrisk.app.model.ResponseLever;
import my.hrddrisk.app.model.RiskBand;
import my.hrddrisk.app.model.RiskEngineConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RiskEngineTest {
	private static final CountryRiskRecord USA = new CountryRiskRecord(
			"United States of America", "USA", 67.5, 35.0, 9.9, 43.7, 3.3, 48.0);
	private static final CountryRiskRecord DEU = new CountryRiskRecord(
			"Germany", "DEU", 0.0, 25.0, 15.2, 16.8, 0.6, 20.0);

	private final RiskEngine engine = new RiskEngine(RiskEngineConfig.defaults());

	@Test
	void weightedRiskUsesDefaultWeights() {
		assertThat(engine.weightedRisk(USA)).isCloseTo(2569.5 / 65.0, within(1e-9));
	}

	@Test
	void weightedRiskSkipsZeroFactorsTogetherWithTheirWeight() {
		assertThat(engine.weightedRisk(DEU)).isCloseTo(750.0 / 45.0, within(1e-9));
	}

	@Test
	void weightedRiskOfCountryWithoutDataIsZero() {
		CountryRiskRecord empty = new CountryRiskRecord("Nowhere", "NWH", 0.0, 0.0, null, 0.0, Double.NaN, 0.0);

		assertThat(engine.weightedRisk(empty)).isZero();
		assertThat(engine.weightedRisk(null)).isZero();
	}

	@Test
	void weightedRiskClampsWeightsAndRejectsWrongLength() {
		assertThat(engine.weightedRisk(USA, List.of(100.0, 0.0, 0.0, 0.0, 0.0))).isCloseTo(67.5, within(1e-9));
		assertThat(engine.weightedRisk(USA, List.of(-10.0, 10.0, 0.0, 0.0, 0.0))).isCloseTo(35.0, within(1e-9));
		assertThat(engine.weightedRisk(USA, List.of(1.0, 1.0))).isZero();
		assertThat(engine.weightedRisk(USA, null)).isZero();
	}

	@Test
	void zeroFocusGivesEveryCountryTheSameCoverage() {
		ManagedRiskDetails details = engine.managedRiskDetails(twoCountryInput(0.0));

		assertThat(details.baselineRisk()).isCloseTo(50.0, within(1e-9));
		assertThat(details.riskConcentration()).isCloseTo(1.36, within(1e-9));
		assertThat(details.portfolioFocusMultiplier()).isCloseTo(1.0, within(1e-12));
		assertThat(details.countryCoverage().get("A")).isEqualTo(details.countryCoverage().get("B"));
		assertThat(details.countryCoverage().get("A")).containsExactly(5.0, 15.0, 25.0, 60.0, 80.0, 90.0);
		assertThat(details.countryManagedRisks().get("A")).isCloseTo(71.5655, within(1e-3));
		assertThat(details.countryManagedRisks().get("B")).isCloseTo(17.8914, within(1e-3));
		assertThat(details.managedRisk()).isCloseTo((71.5655 + 17.8914) / 2.0, within(1e-3));
		assertThat(details.rankAdjustments()).isEmpty();
	}

	@Test
	void fullFocusConcentratesEffortOnHighRiskCountry() {
		ManagedRiskDetails details = engine.managedRiskDetails(twoCountryInput(1.0));

		assertThat(details.portfolioFocusMultiplier()).isCloseTo(1.99, within(1e-9));
		ManagedRiskDetails.CountryDetail high = detail(details, "A");
		ManagedRiskDetails.CountryDetail low = detail(details, "B");
		assertThat(high.biasedRiskRatio()).isCloseTo(1.5 + Math.sqrt(2.0) - 1.0, within(1e-9));
		assertThat(high.focusMultiplier()).isCloseTo(2.388, within(1e-9));
		assertThat(high.effectivenessCap()).isCloseTo(0.54, within(1e-12));
		assertThat(low.biasedRiskRatio()).isCloseTo(0.14, within(1e-9));
		assertThat(low.focusMultiplier()).isNegative();

		assertThat(details.countryManagedRisks().get("B")).isEqualTo(20.0);
		assertThat(details.countryManagedRisks().get("A")).isGreaterThanOrEqualTo(36.8).isLessThan(80.0);
		assertThat(details.countryManagedRisks().get("A")).isCloseTo(45.8665, within(1e-3));
		assertThat(high.transparencyEffectiveness()).isGreaterThan(low.transparencyEffectiveness());
		assertThat(details.focusEffectivenessMetrics().focusExponent()).isCloseTo(2.0, within(1e-12));
		assertThat(details.focusEffectivenessMetrics().conservationFactors()).hasSize(MonitoringTool.count());
	}

	@Test
	void repeatedEvaluationIsIdentical() {
		ManagedRiskInput input = demoInput(0.75);

		assertThat(engine.managedRiskDetails(input)).isEqualTo(engine.managedRiskDetails(input));
		assertThat(new RiskEngine(RiskEngineConfig.defaults()).managedRiskDetails(input))
				.isEqualTo(engine.managedRiskDetails(input));
	}

	@Test
	void managedRisksKeepBaselineOrderAndResidualFloor() {
		Map<String, Double> risks = demoRisks();
		for (int step = 0; step <= 10; step++) {
			double focus = step / 10.0;
			ManagedRiskDetails details = engine.managedRiskDetails(demoInput(focus));

			List<String> byBaseline = new ArrayList<>(risks.keySet());
			byBaseline.sort(Comparator.comparing((String code) -> risks.get(code)).reversed()
					.thenComparing(Comparator.naturalOrder()));
			double previous = Double.POSITIVE_INFINITY;
			for (String code : byBaseline) {
				double managed = details.countryManagedRisks().get(code);
				assertThat(managed).isLessThanOrEqualTo(previous);
				assertThat(managed).isGreaterThanOrEqualTo(risks.get(code) * 0.25 - 1e-9);
				assertThat(managed).isLessThanOrEqualTo(risks.get(code) + 1e-9);
				previous = managed;
			}
			assertThat(details.focusEffectivenessMetrics().focusedTransparency()).isLessThanOrEqualTo(0.90);
			assertThat(details.riskConcentration()).isGreaterThanOrEqualTo(1.0);
			assertThat(details.baselineRisk()).isBetween(0.0, 100.0);
		}
	}

	@Test
	void emptySelectionProducesZeroResult() {
		ManagedRiskDetails details = engine.managedRiskDetails(
				ManagedRiskInput.withDefaultStrategy(List.of(), Map.of(), Map.of(), 0.6));

		assertThat(details.managedRisk()).isZero();
		assertThat(details.baselineRisk()).isZero();
		assertThat(details.riskConcentration()).isEqualTo(1.0);
		assertThat(details.countryManagedRisks()).isEmpty();
		assertThat(engine.managedRiskDetails(null).managedRisk()).isZero();
	}

	@Test
	void zeroBaselineKeepsCountryRisks() {
		ManagedRiskDetails details = engine.managedRiskDetails(ManagedRiskInput.withDefaultStrategy(
				List.of("A", "B"), Map.of("A", 0.0, "B", 0.0), Map.of("A", 70.0, "B", 70.0), 0.6));

		assertThat(details.managedRisk()).isZero();
		assertThat(details.countryManagedRisks()).containsEntry("A", 70.0).containsEntry("B", 70.0);
		assertThat(details.rankAdjustments()).isEmpty();
	}

	@Test
	void invalidCoverageVectorRemovesTransparencyOnly() {
		ManagedRiskInput input = new ManagedRiskInput(
				List.of("A", "B"),
				Map.of("A", 10.0, "B", 10.0),
				Map.of("A", 80.0, "B", 20.0),
				List.of(50.0, 50.0),
				null,
				null,
				null,
				0.6);

		ManagedRiskDetails details = engine.managedRiskDetails(input);

		assertThat(details.countryCoverage().get("A")).containsOnly(0.0);
		assertThat(details.combinedEffectiveness()).isZero();
		assertThat(details.managedRisk()).isCloseTo(details.baselineRisk(), within(1e-9));
		assertThat(details.focusEffectivenessMetrics().responsivenessEffectiveness())
				.isCloseTo(25.0 / 70.0, within(1e-12));
	}

	@Test
	void nullFocusFallsBackToConfiguredDefault() {
		ManagedRiskDetails withNull = engine.managedRiskDetails(twoCountryInput(null));
		ManagedRiskDetails withDefault = engine.managedRiskDetails(twoCountryInput(0.6));

		assertThat(withNull).isEqualTo(withDefault);
	}

	@Test
	void strongerFocusLowersPortfolioManagedRisk() {
		double unfocused = engine.managedRiskDetails(twoCountryInput(0.0)).managedRisk();
		double focused = engine.managedRiskDetails(twoCountryInput(1.0)).managedRisk();

		assertThat(focused).isLessThan(unfocused);
	}

	@Test
	void bandsAndColours() {
		assertThat(engine.riskBand(0.0)).isEqualTo(RiskBand.LOW);
		assertThat(engine.riskBand(19.99)).isEqualTo(RiskBand.LOW);
		assertThat(engine.riskBand(20.0)).isEqualTo(RiskBand.MEDIUM);
		assertThat(engine.riskBand(59.9)).isEqualTo(RiskBand.MEDIUM_HIGH);
		assertThat(engine.riskBand(60.0)).isEqualTo(RiskBand.HIGH);
		assertThat(engine.riskBand(80.0)).isEqualTo(RiskBand.VERY_HIGH);
		assertThat(engine.riskBand(250.0)).isEqualTo(RiskBand.VERY_HIGH);
		assertThat(engine.riskBand(-4.0)).isEqualTo(RiskBand.LOW);
		assertThat(engine.riskBand(Double.NaN)).isEqualTo(RiskBand.LOW);
		assertThat(engine.riskColor(45.0)).isEqualTo("#f97316");
		assertThat(engine.riskColor(95.0)).isEqualTo("#991b1b");
	}

	@Test
	void riskReductionInPercent() {
		assertThat(engine.riskReduction(50.0, 30.0)).isCloseTo(40.0, within(1e-12));
		assertThat(engine.riskReduction(0.0, 30.0)).isZero();
	}

	@Test
	void strategyBreakdownDescribesToolsAndLevers() {
		StrategyBreakdown breakdown = engine.strategyBreakdown(
				RiskEngineConfig.DEFAULT_COVERAGE,
				RiskEngineConfig.DEFAULT_TRANSPARENCY_EFFECTIVENESS,
				RiskEngineConfig.DEFAULT_RESPONSIVENESS_STRATEGY,
				RiskEngineConfig.DEFAULT_RESPONSIVENESS_EFFECTIVENESS,
				0.6,
				1.36);

		assertThat(breakdown.monitoringTools()).hasSize(MonitoringTool.count());
		StrategyBreakdown.ToolContribution workerVoice = breakdown.monitoringTools().get(0);
		assertThat(workerVoice.name()).isEqualTo("Continuous Worker Voice");
		assertThat(workerVoice.category()).isEqualTo("Worker Voice");
		assertThat(workerVoice.baseEffectiveness()).isEqualTo(90L);
		assertThat(workerVoice.averageEffectiveness()).isEqualTo(90L);
		assertThat(workerVoice.contribution()).isCloseTo(4.5, within(1e-9));

		assertThat(breakdown.responseLevers()).hasSize(ResponseLever.count());
		assertThat(breakdown.responseLevers().get(2).weightShare()).isCloseTo(20.0 / 70.0, within(1e-12));
		assertThat(breakdown.primaryResponse().method()).isEqualTo(ResponseLever.CORRECTIVE_ACTION_PLANS.getLabel());
		assertThat(breakdown.primaryResponse().effectiveness()).isEqualTo(35.0);
		assertThat(breakdown.overallTransparency()).isCloseTo(0.2952, within(1e-4));
		assertThat(breakdown.overallResponsiveness()).isCloseTo(25.0 / 70.0, within(1e-12));
		assertThat(breakdown.focus().portfolioMultiplier())
				.isCloseTo((1.0 - 0.6 * 2.75) + 0.6 * 2.75 * 1.36, within(1e-12));
	}

	@Test
	void strategyBreakdownClampsLeverWeights() {
		StrategyBreakdown breakdown = engine.strategyBreakdown(
				RiskEngineConfig.DEFAULT_COVERAGE,
				RiskEngineConfig.DEFAULT_TRANSPARENCY_EFFECTIVENESS,
				List.of(200.0, 0.0, 0.0, 0.0, 0.0, 100.0),
				List.of(100.0, 0.0, 0.0, 0.0, 0.0, 0.0),
				0.0,
				1.0);

		assertThat(breakdown.responseLevers().get(0).weight()).isEqualTo(100.0);
		assertThat(breakdown.responseLevers().get(0).weightShare()).isCloseTo(0.5, within(1e-12));
		assertThat(breakdown.primaryResponse().weight()).isEqualTo(100.0);
		assertThat(breakdown.overallResponsiveness()).isCloseTo(0.5, within(1e-12));
	}

	@Test
	void strategyBreakdownZeroesTablesForMalformedVectors() {
		StrategyBreakdown breakdown = engine.strategyBreakdown(
				List.of(50.0, 50.0),
				RiskEngineConfig.DEFAULT_TRANSPARENCY_EFFECTIVENESS,
				RiskEngineConfig.DEFAULT_RESPONSIVENESS_STRATEGY,
				List.of(70.0),
				0.6,
				1.36);

		assertThat(breakdown.monitoringTools()).hasSize(MonitoringTool.count());
		assertThat(breakdown.monitoringTools()).allSatisfy(tool -> {
			assertThat(tool.coverage()).isZero();
			assertThat(tool.userEffectiveness()).isZero();
			assertThat(tool.contribution()).isZero();
		});
		assertThat(breakdown.responseLevers()).hasSize(ResponseLever.count());
		assertThat(breakdown.responseLevers()).allSatisfy(lever -> {
			assertThat(lever.weight()).isZero();
			assertThat(lever.weightShare()).isZero();
		});
		assertThat(breakdown.primaryResponse().weight()).isZero();
		assertThat(breakdown.overallTransparency()).isZero();
		assertThat(breakdown.overallResponsiveness()).isZero();
	}

	@Test
	void hugeVolumesKeepPortfolioFiguresFinite() {
		ManagedRiskDetails details = engine.managedRiskDetails(ManagedRiskInput.withDefaultStrategy(
				List.of("A", "B"),
				Map.of("A", 1e308, "B", 1e308),
				Map.of("A", 80.0, "B", 20.0),
				0.6));
		ManagedRiskDetails reference = engine.managedRiskDetails(twoCountryInput(0.6));

		assertThat(details.baselineRisk()).isCloseTo(50.0, within(1e-9));
		assertThat(details.managedRisk()).isCloseTo(reference.managedRisk(), within(1e-9));
		assertThat(details.focusEffectivenessMetrics().conservationFactors())
				.containsExactlyElementsOf(reference.focusEffectivenessMetrics().conservationFactors());
	}

	@Test
	void riskSummaryCombinesBandsAndImprovement() {
		ManagedRiskInput input = twoCountryInput(1.0);
		ManagedRiskDetails details = engine.managedRiskDetails(input);

		RiskSummary summary = engine.riskSummary(input, details);

		assertThat(summary.baseline().band()).isEqualTo(RiskBand.MEDIUM_HIGH);
		assertThat(summary.managed().score()).isEqualTo(details.managedRisk());
		assertThat(summary.managed().color()).isEqualTo(summary.managed().band().getColor());
		assertThat(summary.improvement().improvement()).isTrue();
		assertThat(summary.improvement().absoluteReduction())
				.isCloseTo(details.baselineRisk() - details.managedRisk(), within(1e-12));
		assertThat(summary.portfolio().countriesSelected()).isEqualTo(2);
		assertThat(summary.portfolio().riskConcentration()).isCloseTo(1.36, within(1e-9));
		assertThat(engine.riskSummary(input, null)).isEqualTo(summary);
	}

	private static ManagedRiskDetails.CountryDetail detail(ManagedRiskDetails details, String code) {
		return details.countryDetails().stream()
				.filter(detail -> code.equals(detail.isoCode()))
				.findFirst()
				.orElseThrow();
	}

	private static ManagedRiskInput twoCountryInput(Double focus) {
		return ManagedRiskInput.withDefaultStrategy(
				List.of("A", "B"),
				Map.of("A", 10.0, "B", 10.0),
				Map.of("A", 80.0, "B", 20.0),
				focus);
	}

	private static Map<String, Double> demoRisks() {
		Map<String, Double> risks = new HashMap<>();
		risks.put("USA", 48.0);
		risks.put("CHN", 68.0);
		risks.put("DEU", 20.0);
		risks.put("GBR", 43.0);
		risks.put("JPN", 24.0);
		risks.put("IND", 67.0);
		risks.put("BRA", 60.0);
		risks.put("FRA", 26.0);
		return risks;
	}

	private static ManagedRiskInput demoInput(double focus) {
		Map<String, Double> volumes = new HashMap<>();
		volumes.put("USA", 40.0);
		volumes.put("CHN", 25.0);
		volumes.put("IND", 5.0);
		volumes.put("BRA", 12.0);
		List<String> selection = new ArrayList<>(demoRisks().keySet());
		Collections.sort(selection);
		return ManagedRiskInput.withDefaultStrategy(selection, volumes, demoRisks(), focus);
	}
}
