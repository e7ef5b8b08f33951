package my.hrddrisk.app.engine;

import my.hrddrisk.app.model.MonitoringTool;
import my.hrddrisk.app.model.RiskEngineConfig;
import my.hrddrisk.app.model.RiskModelConstants;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EffectivenessModelTest {
	private final EffectivenessModel model = new EffectivenessModel(RiskModelConstants.DEFAULTS);

	@Test
	void defaultStrategyTransparency() {
		double transparency = model.transparencyEffectiveness(
				RiskEngineConfig.DEFAULT_COVERAGE, RiskEngineConfig.DEFAULT_TRANSPARENCY_EFFECTIVENESS);

		assertThat(transparency).isCloseTo(0.2952, within(1e-4));
	}

	@Test
	void transparencyIsCappedAtNinetyPercent() {
		List<Double> full = Collections.nCopies(MonitoringTool.count(), 100.0);

		assertThat(model.transparencyEffectiveness(full, full)).isEqualTo(0.90);
	}

	@Test
	void wrongLengthVectorGivesZeroTransparency() {
		assertThat(model.transparencyEffectiveness(List.of(50.0, 50.0), RiskEngineConfig.DEFAULT_TRANSPARENCY_EFFECTIVENESS))
				.isZero();
		assertThat(model.transparencyEffectiveness(null, null)).isZero();
	}

	@Test
	void outOfRangeCoverageIsClamped() {
		List<Double> tooHigh = List.of(500.0, 500.0, 500.0, 500.0, 500.0, 500.0);
		List<Double> hundred = Collections.nCopies(MonitoringTool.count(), 100.0);
		List<Double> negative = List.of(-5.0, -5.0, -5.0, -5.0, -5.0, -5.0);

		assertThat(model.transparencyEffectiveness(tooHigh, RiskEngineConfig.DEFAULT_TRANSPARENCY_EFFECTIVENESS))
				.isEqualTo(model.transparencyEffectiveness(hundred, RiskEngineConfig.DEFAULT_TRANSPARENCY_EFFECTIVENESS));
		assertThat(model.transparencyEffectiveness(negative, RiskEngineConfig.DEFAULT_TRANSPARENCY_EFFECTIVENESS)).isZero();
	}

	@Test
	void effectiveRateAveragesBaseAndUserValue() {
		assertThat(model.effectiveRate(MonitoringTool.CONTINUOUS_WORKER_VOICE, 90.0)).isCloseTo(0.90, within(1e-12));
		assertThat(model.effectiveRate(MonitoringTool.DESK_BASED_ASSESSMENT, 45.0)).isCloseTo(0.25, within(1e-12));
	}

	@Test
	void responsivenessIsWeightedMean() {
		double responsiveness = model.responsivenessEffectiveness(
				RiskEngineConfig.DEFAULT_RESPONSIVENESS_STRATEGY, RiskEngineConfig.DEFAULT_RESPONSIVENESS_EFFECTIVENESS);

		assertThat(responsiveness).isCloseTo(25.0 / 70.0, within(1e-12));
	}

	@Test
	void responsivenessIgnoresNegativeWeightsAndHandlesZeroTotal() {
		List<Double> effectiveness = List.of(100.0, 0.0, 0.0, 0.0, 0.0, 0.0);

		assertThat(model.responsivenessEffectiveness(List.of(10.0, -10.0, 0.0, 0.0, 0.0, 0.0), effectiveness))
				.isCloseTo(1.0, within(1e-12));
		assertThat(model.responsivenessEffectiveness(Collections.nCopies(6, 0.0), effectiveness)).isZero();
		assertThat(model.responsivenessEffectiveness(List.of(1.0), List.of(1.0))).isZero();
	}

	@Test
	void responsivenessClampsLeverWeightsToPercent() {
		List<Double> effectiveness = List.of(100.0, 0.0, 0.0, 0.0, 0.0, 0.0);

		assertThat(model.responsivenessEffectiveness(List.of(200.0, 0.0, 0.0, 0.0, 0.0, 100.0), effectiveness))
				.isCloseTo(0.5, within(1e-12));
	}

	@Test
	void effectivenessCapFallsWithRisk() {
		assertThat(model.effectivenessCap(0.0)).isCloseTo(0.70, within(1e-12));
		assertThat(model.effectivenessCap(50.0)).isCloseTo(0.60, within(1e-12));
		assertThat(model.effectivenessCap(100.0)).isCloseTo(0.50, within(1e-12));
	}

	@Test
	void managedOutcomeRespectsCapAndFloor() {
		EffectivenessModel.ManagedOutcome capped = model.managedOutcome(80.0, 0.9, 1.0, 2.0);

		assertThat(capped.reductionFactor()).isCloseTo(1.8, within(1e-12));
		assertThat(capped.cappedFactor()).isCloseTo(0.54, within(1e-12));
		assertThat(capped.managedRisk()).isCloseTo(36.8, within(1e-9));

		EffectivenessModel.ManagedOutcome negative = model.managedOutcome(20.0, 0.5, 0.5, -1.365);
		assertThat(negative.cappedFactor()).isZero();
		assertThat(negative.managedRisk()).isEqualTo(20.0);
	}

	@Test
	void residualFloorHoldsWithLooseCap() {
		RiskModelConstants loose = new RiskModelConstants(2.75, 0.08, 2.5, 1.4, 2.0, 0.3, 0.3, 0.90, 0.90, 0.10,
				0.25, 0.5);
		EffectivenessModel looseModel = new EffectivenessModel(loose);

		assertThat(looseModel.managedOutcome(60.0, 0.9, 1.0, 3.0).managedRisk()).isCloseTo(15.0, within(1e-9));
	}
}
