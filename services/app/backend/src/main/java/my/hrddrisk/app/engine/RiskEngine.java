package my.hrddrisk.app.engine;

import my.hrddrisk.app.model.CountryRiskRecord;
import my.hrddrisk.app.model.MonitoringTool;
import my.hrddrisk.app.model.ResponseLever;
import my.hrddrisk.app.model.RiskBand;
import my.hrddrisk.app.model.RiskEngineConfig;
import my.hrddrisk.app.model.RiskFactor;
import my.hrddrisk.app.util.ScoreMath;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the scoring engine. Stateless apart from the immutable configuration it is built with, so
 * one instance can serve concurrent callers.
 */
public class RiskEngine {
	private static final double MAX_FACTOR_WEIGHT = 50.0;

	private final RiskEngineConfig config;
	private final PortfolioMetricsCalculator metricsCalculator;
	private final FocusBiasModel focusBiasModel;
	private final CoverageAllocator coverageAllocator;
	private final EffectivenessModel effectivenessModel;
	private final RankPreservationPass rankPreservationPass;

	public RiskEngine(RiskEngineConfig config) {
		this.config = config == null ? RiskEngineConfig.defaults() : config;
		this.metricsCalculator = new PortfolioMetricsCalculator(this.config.defaultVolume());
		this.focusBiasModel = new FocusBiasModel(this.config.constants());
		this.coverageAllocator = new CoverageAllocator(this.config.constants());
		this.effectivenessModel = new EffectivenessModel(this.config.constants());
		this.rankPreservationPass = new RankPreservationPass(this.config.constants());
	}

	public RiskEngineConfig getConfig() {
		return config;
	}

	public FocusBiasModel focusBiasModel() {
		return focusBiasModel;
	}

	public CoverageAllocator coverageAllocator() {
		return coverageAllocator;
	}

	public EffectivenessModel effectivenessModel() {
		return effectivenessModel;
	}

	public double weightedRisk(CountryRiskRecord record) {
		return weightedRisk(record, config.defaultWeights());
	}

	/**
	 * Weighted mean of the positive factor values. Zero or missing factors drop out together with their weight,
	 * so a country with no data scores 0 rather than NaN.
	 */
	public double weightedRisk(CountryRiskRecord record, List<Double> weights) {
		if (record == null || weights == null || weights.size() != RiskFactor.count()) {
			return 0.0;
		}
		List<Double> values = record.factorValues();
		double weightedSum = 0.0;
		double totalWeight = 0.0;
		for (int i = 0; i < values.size(); i++) {
			double value = ScoreMath.finiteOrZero(values.get(i));
			if (value <= 0) {
				continue;
			}
			double weight = ScoreMath.clamp(ScoreMath.finiteOrZero(weights.get(i)), 0.0, MAX_FACTOR_WEIGHT);
			weightedSum += value * weight;
			totalWeight += weight;
		}
		return totalWeight > 0 ? weightedSum / totalWeight : 0.0;
	}

	public PortfolioMetrics portfolioMetrics(Collection<String> selection,
											 Map<String, Double> volumes,
											 Map<String, Double> risks) {
		return metricsCalculator.calculate(selection, volumes, risks);
	}

	public double transparencyEffectiveness(List<Double> coverage, List<Double> effectiveness) {
		return effectivenessModel.transparencyEffectiveness(coverage, effectiveness);
	}

	public double responsivenessEffectiveness(List<Double> strategy, List<Double> effectiveness) {
		return effectivenessModel.responsivenessEffectiveness(strategy, effectiveness);
	}

	public ManagedRiskDetails managedRiskDetails(ManagedRiskInput input) {
		ManagedRiskInput resolved = resolveDefaults(input);
		double focus = ScoreMath.sanitizeFocus(resolved.focus(), config.defaultFocus());
		List<String> selection = PortfolioMetricsCalculator.distinctCodes(resolved.selectedCountries());
		if (selection.isEmpty()) {
			return emptyDetails(focus);
		}

		PortfolioMetrics metrics = metricsCalculator.calculate(selection, resolved.countryVolumes(), resolved.countryRisks());
		double baselineRisk = metrics.baselineRisk();
		double concentration = metrics.riskConcentration();
		double portfolioMultiplier = focusBiasModel.portfolioFocusMultiplier(focus, concentration);

		double[] coverage = ScoreMath.toPercentArray(resolved.coverage(), MonitoringTool.count());
		double[] transparencyInputs = ScoreMath.toPercentArray(resolved.transparencyEffectiveness(), MonitoringTool.count());
		double uniformTransparency = effectivenessModel.transparency(coverage, transparencyInputs);
		double responsiveness = effectivenessModel.responsivenessEffectiveness(
				resolved.responsivenessStrategy(), resolved.responsivenessEffectiveness());

		List<CountryExposure> exposures = new ArrayList<>(selection.size());
		for (String code : selection) {
			double volume = metricsCalculator.resolveVolume(resolved.countryVolumes(), code);
			double risk = metricsCalculator.resolveRisk(resolved.countryRisks(), code);
			double rawRatio = baselineRisk > 0 ? risk / baselineRisk : 1.0;
			double biasedRatio = focusBiasModel.biasedRiskRatio(rawRatio, focus, risk, baselineRisk);
			exposures.add(new CountryExposure(code, volume, risk, biasedRatio));
		}
		CoverageAllocator.CoverageAllocation allocation = coverageAllocator.allocate(exposures, coverage, focus);

		List<RankPreservationPass.RankEntry> rankEntries = new ArrayList<>(exposures.size());
		Map<String, CountryTrace> traces = new LinkedHashMap<>();
		for (CountryExposure exposure : exposures) {
			double countryTransparency = countryTransparency(allocation.countryCoverage().get(exposure.isoCode()),
					transparencyInputs);
			double countryMultiplier = focusBiasModel.countryFocusMultiplier(
					focus, portfolioMultiplier, exposure.biasedRatio(), exposure.risk());
			EffectivenessModel.ManagedOutcome outcome;
			if (baselineRisk > 0) {
				outcome = effectivenessModel.managedOutcome(exposure.risk(), countryTransparency, responsiveness,
						countryMultiplier);
			} else {
				outcome = new EffectivenessModel.ManagedOutcome(0.0, effectivenessModel.effectivenessCap(exposure.risk()),
						0.0, exposure.risk());
			}
			traces.put(exposure.isoCode(), new CountryTrace(exposure, countryTransparency, countryMultiplier, outcome));
			rankEntries.add(new RankPreservationPass.RankEntry(exposure.isoCode(), exposure.risk(), outcome.managedRisk()));
		}
		// without a baseline there is nothing to reduce, every country keeps its own risk
		RankPreservationPass.RankResult rankResult = baselineRisk > 0
				? rankPreservationPass.apply(rankEntries)
				: new RankPreservationPass.RankResult(Map.of(), List.of());

		double volumeScale = ScoreMath.volumeScale(exposures.stream().mapToDouble(CountryExposure::volume).toArray());
		double totalVolume = 0.0;
		double managedVolume = 0.0;
		double transparencyVolume = 0.0;
		double multiplierVolume = 0.0;
		Map<String, Double> managedByCountry = new LinkedHashMap<>();
		List<ManagedRiskDetails.CountryDetail> details = new ArrayList<>(traces.size());
		for (CountryTrace trace : traces.values()) {
			CountryExposure exposure = trace.exposure();
			double corrected = rankResult.correctedRisks().getOrDefault(exposure.isoCode(), trace.outcome().managedRisk());
			managedByCountry.put(exposure.isoCode(), corrected);
			double weight = exposure.volume() / volumeScale;
			totalVolume += weight;
			managedVolume += weight * corrected;
			transparencyVolume += weight * trace.transparency();
			multiplierVolume += weight * trace.focusMultiplier();
			details.add(new ManagedRiskDetails.CountryDetail(
					exposure.isoCode(),
					exposure.volume(),
					exposure.risk(),
					exposure.biasedRatio(),
					trace.focusMultiplier(),
					trace.transparency(),
					trace.outcome().reductionFactor(),
					trace.outcome().effectivenessCap(),
					trace.outcome().managedRisk(),
					corrected
			));
		}

		double managedRisk = baselineRisk > 0 && totalVolume > 0 ? managedVolume / totalVolume : 0.0;
		double focusedTransparency = totalVolume > 0 ? transparencyVolume / totalVolume : uniformTransparency;
		double averageMultiplier = totalVolume > 0 ? multiplierVolume / totalVolume : portfolioMultiplier;
		ManagedRiskDetails.FocusEffectivenessMetrics focusMetrics = new ManagedRiskDetails.FocusEffectivenessMetrics(
				focus,
				focusBiasModel.focusExponent(focus),
				portfolioMultiplier,
				uniformTransparency,
				focusedTransparency,
				focusedTransparency - uniformTransparency,
				responsiveness,
				averageMultiplier,
				allocation.conservationFactors(),
				rankResult.adjustments().size()
		);

		return new ManagedRiskDetails(
				managedRisk,
				baselineRisk,
				concentration,
				portfolioMultiplier,
				focusedTransparency * responsiveness,
				Collections.unmodifiableMap(managedByCountry),
				allocation.countryCoverage(),
				focusMetrics,
				List.copyOf(details),
				rankResult.adjustments()
		);
	}

	public double riskReduction(double baselineRisk, double managedRisk) {
		if (!(baselineRisk > 0)) {
			return 0.0;
		}
		return (baselineRisk - managedRisk) / baselineRisk * 100.0;
	}

	public RiskBand riskBand(double score) {
		return RiskBand.forScore(score);
	}

	public String riskColor(double score) {
		return RiskBand.forScore(score).getColor();
	}

	public StrategyBreakdown strategyBreakdown(List<Double> coverage,
											   List<Double> transparencyEffectiveness,
											   List<Double> responsivenessStrategy,
											   List<Double> responsivenessEffectiveness,
											   double focus,
											   double riskConcentration) {
		double sanitizedFocus = ScoreMath.clampUnit(ScoreMath.finiteOrZero(focus));
		double concentration = Double.isFinite(riskConcentration) && riskConcentration > 0
				? Math.max(1.0, riskConcentration)
				: 1.0;

		// a malformed vector zeroes the whole tool or lever table, matching the overall figures
		double[] coverageValues = ScoreMath.toPercentArray(coverage, MonitoringTool.count());
		double[] toolEffectiveness = ScoreMath.toPercentArray(transparencyEffectiveness, MonitoringTool.count());
		if (coverageValues == null || toolEffectiveness == null) {
			coverageValues = new double[MonitoringTool.count()];
			toolEffectiveness = new double[MonitoringTool.count()];
		}
		List<StrategyBreakdown.ToolContribution> tools = new ArrayList<>();
		for (MonitoringTool tool : MonitoringTool.values()) {
			double toolCoverage = coverageValues[tool.ordinal()];
			double userEffectiveness = toolEffectiveness[tool.ordinal()];
			double averageRate = effectivenessModel.effectiveRate(tool, userEffectiveness);
			tools.add(new StrategyBreakdown.ToolContribution(
					tool.getLabel(),
					tool.getCategory().getDisplayName(),
					toolCoverage,
					Math.round(tool.getBaseEffectiveness() * 100.0),
					userEffectiveness,
					Math.round(averageRate * 100.0),
					toolCoverage * averageRate
			));
		}

		double[] leverWeights = ScoreMath.toPercentArray(responsivenessStrategy, ResponseLever.count());
		double[] leverEffectiveness = ScoreMath.toPercentArray(responsivenessEffectiveness, ResponseLever.count());
		if (leverWeights == null || leverEffectiveness == null) {
			leverWeights = new double[ResponseLever.count()];
			leverEffectiveness = new double[ResponseLever.count()];
		}
		double totalLeverWeight = 0.0;
		for (double weight : leverWeights) {
			totalLeverWeight += weight;
		}
		List<StrategyBreakdown.LeverContribution> levers = new ArrayList<>();
		ResponseLever primary = ResponseLever.values()[0];
		double primaryWeight = 0.0;
		for (ResponseLever lever : ResponseLever.values()) {
			double weight = leverWeights[lever.ordinal()];
			double effectiveness = leverEffectiveness[lever.ordinal()];
			levers.add(new StrategyBreakdown.LeverContribution(lever.getLabel(), weight, effectiveness,
					totalLeverWeight > 0 ? weight / totalLeverWeight : 0.0));
			if (weight > primaryWeight) {
				primaryWeight = weight;
				primary = lever;
			}
		}
		StrategyBreakdown.PrimaryResponse primaryResponse = new StrategyBreakdown.PrimaryResponse(
				primary.getLabel(),
				primaryWeight,
				leverEffectiveness[primary.ordinal()]);

		return new StrategyBreakdown(
				List.copyOf(tools),
				List.copyOf(levers),
				transparencyEffectiveness(coverage, transparencyEffectiveness),
				responsivenessEffectiveness(responsivenessStrategy, responsivenessEffectiveness),
				primaryResponse,
				new StrategyBreakdown.FocusSummary(sanitizedFocus, concentration,
						focusBiasModel.portfolioFocusMultiplier(sanitizedFocus, concentration))
		);
	}

	public RiskSummary riskSummary(ManagedRiskInput input, ManagedRiskDetails details) {
		ManagedRiskInput resolved = resolveDefaults(input);
		ManagedRiskDetails resolvedDetails = details == null ? managedRiskDetails(resolved) : details;
		double baseline = resolvedDetails.baselineRisk();
		double managed = resolvedDetails.managedRisk();
		StrategyBreakdown breakdown = strategyBreakdown(
				resolved.coverage(),
				resolved.transparencyEffectiveness(),
				resolved.responsivenessStrategy(),
				resolved.responsivenessEffectiveness(),
				ScoreMath.sanitizeFocus(resolved.focus(), config.defaultFocus()),
				resolvedDetails.riskConcentration());
		return new RiskSummary(
				RiskSummary.ScoreBand.of(baseline),
				RiskSummary.ScoreBand.of(managed),
				new RiskSummary.Improvement(riskReduction(baseline, managed), baseline - managed, managed < baseline),
				new RiskSummary.PortfolioOverview(
						PortfolioMetricsCalculator.distinctCodes(resolved.selectedCountries()).size(),
						baseline,
						resolvedDetails.riskConcentration()),
				breakdown
		);
	}

	private double countryTransparency(List<Double> countryCoverage, double[] transparencyInputs) {
		if (countryCoverage == null || transparencyInputs == null) {
			return 0.0;
		}
		double[] values = new double[countryCoverage.size()];
		for (int i = 0; i < values.length; i++) {
			values[i] = countryCoverage.get(i);
		}
		return effectivenessModel.transparency(values, transparencyInputs);
	}

	private ManagedRiskDetails emptyDetails(double focus) {
		double portfolioMultiplier = focusBiasModel.portfolioFocusMultiplier(focus, 1.0);
		ManagedRiskDetails.FocusEffectivenessMetrics metrics = new ManagedRiskDetails.FocusEffectivenessMetrics(
				focus,
				focusBiasModel.focusExponent(focus),
				portfolioMultiplier,
				0.0,
				0.0,
				0.0,
				0.0,
				portfolioMultiplier,
				List.of(),
				0
		);
		return new ManagedRiskDetails(0.0, 0.0, 1.0, portfolioMultiplier, 0.0, Map.of(), Map.of(), metrics,
				List.of(), List.of());
	}

	private ManagedRiskInput resolveDefaults(ManagedRiskInput input) {
		if (input == null) {
			return new ManagedRiskInput(List.of(), Map.of(), Map.of(),
					config.defaultCoverage(),
					config.defaultTransparencyEffectiveness(),
					config.defaultResponsivenessStrategy(),
					config.defaultResponsivenessEffectiveness(),
					config.defaultFocus());
		}
		return new ManagedRiskInput(
				input.selectedCountries(),
				input.countryVolumes(),
				input.countryRisks(),
				input.coverage() == null ? config.defaultCoverage() : input.coverage(),
				input.transparencyEffectiveness() == null
						? config.defaultTransparencyEffectiveness()
						: input.transparencyEffectiveness(),
				input.responsivenessStrategy() == null
						? config.defaultResponsivenessStrategy()
						: input.responsivenessStrategy(),
				input.responsivenessEffectiveness() == null
						? config.defaultResponsivenessEffectiveness()
						: input.responsivenessEffectiveness(),
				input.focus() == null ? config.defaultFocus() : input.focus()
		);
	}

	private record CountryTrace(CountryExposure exposure,
								double transparency,
								double focusMultiplier,
								EffectivenessModel.ManagedOutcome outcome) {
	}
}
