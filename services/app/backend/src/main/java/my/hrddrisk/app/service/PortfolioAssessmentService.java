package my.hrddrisk.app.service;

import my.hrddrisk.app.catalog.CountryCatalog;
import my.hrddrisk.app.engine.ManagedRiskDetails;
import my.hrddrisk.app.engine.ManagedRiskInput;
import my.hrddrisk.app.engine.RiskEngine;
import my.hrddrisk.app.engine.RiskSummary;
import my.hrddrisk.app.model.CountryRiskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a country selection against the catalog and runs it through the active risk engine.
 */
@Service
public class PortfolioAssessmentService {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioAssessmentService.class);

	private final CountryCatalog countryCatalog;
	private final RiskEngineConfigService riskEngineConfigService;

	public PortfolioAssessmentService(CountryCatalog countryCatalog, RiskEngineConfigService riskEngineConfigService) {
		this.countryCatalog = countryCatalog;
		this.riskEngineConfigService = riskEngineConfigService;
	}

	public PortfolioAssessment assess(PortfolioAssessmentRequest request) {
		RiskEngine engine = riskEngineConfigService.engine();
		if (request == null) {
			request = new PortfolioAssessmentRequest(List.of(), Map.of(), null, null, null, null, null, null);
		}
		List<Double> weights = request.weights() == null ? engine.getConfig().defaultWeights() : request.weights();

		List<String> selected = new ArrayList<>();
		List<String> unknown = new ArrayList<>();
		Map<String, Double> risks = new LinkedHashMap<>();
		for (String code : normalizeCodes(request.countries())) {
			Optional<CountryRiskRecord> country = countryCatalog.findByIsoCode(code);
			if (country.isEmpty()) {
				unknown.add(code);
				continue;
			}
			selected.add(code);
			risks.put(code, engine.weightedRisk(country.get(), weights));
		}
		if (!unknown.isEmpty()) {
			logger.warn("Skipping unknown country codes {} (catalog {})", unknown, countryCatalog.sourceName());
		}

		Map<String, Double> volumes = new LinkedHashMap<>();
		if (request.volumes() != null) {
			for (Map.Entry<String, Double> entry : request.volumes().entrySet()) {
				if (entry.getKey() != null) {
					volumes.put(entry.getKey().trim().toUpperCase(Locale.ROOT), entry.getValue());
				}
			}
		}

		ManagedRiskInput input = new ManagedRiskInput(
				selected,
				volumes,
				risks,
				request.coverage(),
				request.transparencyEffectiveness(),
				request.responsivenessStrategy(),
				request.responsivenessEffectiveness(),
				request.focus()
		);
		ManagedRiskDetails details = engine.managedRiskDetails(input);
		RiskSummary summary = engine.riskSummary(input, details);
		return new PortfolioAssessment(
				List.copyOf(selected),
				List.copyOf(unknown),
				Collections.unmodifiableMap(risks),
				details,
				summary
		);
	}

	/**
	 * Weighted risk of every catalog country, keyed by ISO code in catalog order.
	 */
	public Map<String, Double> countryRisks(List<Double> weights) {
		RiskEngine engine = riskEngineConfigService.engine();
		List<Double> resolvedWeights = weights == null ? engine.getConfig().defaultWeights() : weights;
		Map<String, Double> risks = new LinkedHashMap<>();
		for (CountryRiskRecord country : countryCatalog.findAll()) {
			if (country.isoCode() == null || country.isoCode().isBlank()) {
				continue;
			}
			risks.put(country.isoCode(), engine.weightedRisk(country, resolvedWeights));
		}
		return Collections.unmodifiableMap(risks);
	}

	private List<String> normalizeCodes(List<String> codes) {
		if (codes == null || codes.isEmpty()) {
			return List.of();
		}
		Set<String> normalized = new LinkedHashSet<>();
		for (String code : codes) {
			if (code != null && !code.isBlank()) {
				normalized.add(code.trim().toUpperCase(Locale.ROOT));
			}
		}
		return new ArrayList<>(normalized);
	}

	/**
	 * {@code null} strategy vectors, weights and focus take the engine defaults.
	 */
	public record PortfolioAssessmentRequest(List<String> countries,
											 Map<String, Double> volumes,
											 List<Double> weights,
											 List<Double> coverage,
											 List<Double> transparencyEffectiveness,
											 List<Double> responsivenessStrategy,
											 List<Double> responsivenessEffectiveness,
											 Double focus) {
	}

	public record PortfolioAssessment(List<String> countries,
									  List<String> unknownCountries,
									  Map<String, Double> countryRisks,
									  ManagedRiskDetails details,
									  RiskSummary summary) {
	}
}
