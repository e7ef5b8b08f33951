package my.hrddrisk.app.service;

import my.hrddrisk.app.config.AppProperties;
import my.hrddrisk.app.engine.RiskEngine;
import my.hrddrisk.app.model.MonitoringTool;
import my.hrddrisk.app.model.ResponseLever;
import my.hrddrisk.app.model.RiskEngineConfig;
import my.hrddrisk.app.model.RiskFactor;
import my.hrddrisk.app.model.RiskModelConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the active {@link RiskEngine}. A reload builds and validates a complete configuration first and then
 * swaps the engine in one step; calculations already running keep the instance they started with.
 */
@Service
public class RiskEngineConfigService {
	private static final Logger logger = LoggerFactory.getLogger(RiskEngineConfigService.class);
	static final String DEFAULT_RESOURCE = "classpath:risk_engine_defaults.json";
	private static final double MAX_FACTOR_WEIGHT = 50.0;
	private static final double MAX_PERCENT = 100.0;

	private final ResourceLoader resourceLoader;
	private final String defaultsLocation;
	private final ObjectMapper jsonMapper;
	private final AtomicReference<RiskEngine> engine = new AtomicReference<>();

	public RiskEngineConfigService(ResourceLoader resourceLoader, AppProperties properties) {
		this.resourceLoader = resourceLoader;
		String location = properties == null || properties.engine() == null
				? null
				: properties.engine().defaultsResource();
		this.defaultsLocation = location == null || location.isBlank() ? DEFAULT_RESOURCE : location;
		this.jsonMapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.build();
		this.engine.set(new RiskEngine(loadDefaultConfig()));
	}

	public RiskEngine engine() {
		return engine.get();
	}

	public RiskEngineConfig currentConfig() {
		return engine.get().getConfig();
	}

	/**
	 * @throws IllegalArgumentException when the configuration fails validation; the active engine is kept
	 */
	public RiskEngine replace(RiskEngineConfig config) {
		if (config == null) {
			throw new IllegalArgumentException("Risk engine config is required");
		}
		List<String> errors = validate(config);
		if (!errors.isEmpty()) {
			throw new IllegalArgumentException("Invalid risk engine config: " + String.join("; ", errors));
		}
		RiskEngine replacement = new RiskEngine(config);
		engine.set(replacement);
		logger.info("Risk engine configuration replaced (focus={}, volume={})",
				config.defaultFocus(), config.defaultVolume());
		return replacement;
	}

	public RiskEngine reloadDefaults() {
		RiskEngine reloaded = new RiskEngine(loadDefaultConfig());
		engine.set(reloaded);
		logger.info("Risk engine defaults reloaded from {}", defaultsLocation);
		return reloaded;
	}

	public List<String> validate(RiskEngineConfig config) {
		List<String> errors = new ArrayList<>();
		checkVector(errors, "default_weights", config.defaultWeights(), RiskFactor.count(), MAX_FACTOR_WEIGHT);
		checkVector(errors, "default_coverage", config.defaultCoverage(), MonitoringTool.count(), MAX_PERCENT);
		checkVector(errors, "default_transparency_effectiveness", config.defaultTransparencyEffectiveness(),
				MonitoringTool.count(), MAX_PERCENT);
		checkVector(errors, "default_responsiveness_strategy", config.defaultResponsivenessStrategy(),
				ResponseLever.count(), MAX_PERCENT);
		checkVector(errors, "default_responsiveness_effectiveness", config.defaultResponsivenessEffectiveness(),
				ResponseLever.count(), MAX_PERCENT);
		if (!inRange(config.defaultFocus(), 0.0, 1.0)) {
			errors.add("default_focus must be within [0, 1]");
		}
		if (!(Double.isFinite(config.defaultVolume()) && config.defaultVolume() >= 0)) {
			errors.add("default_volume must be a non-negative number");
		}
		errors.addAll(validateConstants(config.constants()));
		return errors;
	}

	RiskEngineConfig loadDefaultConfig() {
		Resource resource = resourceLoader.getResource(defaultsLocation);
		if (!resource.exists()) {
			logger.warn("Risk engine defaults not found at {}, using built-in defaults", defaultsLocation);
			return RiskEngineConfig.defaults();
		}
		try (InputStream inputStream = resource.getInputStream()) {
			String json = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
			return parseConfig(json);
		} catch (IOException | JacksonException ex) {
			logger.error("Failed to read risk engine defaults from {}: {}", defaultsLocation, ex.getMessage());
			return RiskEngineConfig.defaults();
		}
	}

	/**
	 * Reads each field independently; a missing or invalid field keeps its built-in default.
	 */
	RiskEngineConfig parseConfig(String json) {
		RiskEngineConfig defaults = RiskEngineConfig.defaults();
		if (json == null || json.isBlank()) {
			return defaults;
		}
		JsonNode root = jsonMapper.readTree(json);
		if (root == null || !root.isObject()) {
			logger.warn("Risk engine defaults in {} are not a JSON object, using built-in defaults", defaultsLocation);
			return defaults;
		}
		RiskModelConstants constants = parseConstants(root.get("constants"));
		return new RiskEngineConfig(
				readVector(root, "default_weights", RiskFactor.count(), MAX_FACTOR_WEIGHT, defaults.defaultWeights()),
				readVector(root, "default_coverage", MonitoringTool.count(), MAX_PERCENT, defaults.defaultCoverage()),
				readVector(root, "default_transparency_effectiveness", MonitoringTool.count(), MAX_PERCENT,
						defaults.defaultTransparencyEffectiveness()),
				readVector(root, "default_responsiveness_strategy", ResponseLever.count(), MAX_PERCENT,
						defaults.defaultResponsivenessStrategy()),
				readVector(root, "default_responsiveness_effectiveness", ResponseLever.count(), MAX_PERCENT,
						defaults.defaultResponsivenessEffectiveness()),
				readNumber(root, "default_focus", 0.0, 1.0, defaults.defaultFocus()),
				readNumber(root, "default_volume", 0.0, Double.MAX_VALUE, defaults.defaultVolume()),
				constants
		);
	}

	private RiskModelConstants parseConstants(JsonNode node) {
		RiskModelConstants defaults = RiskModelConstants.DEFAULTS;
		if (node == null || !node.isObject()) {
			return defaults;
		}
		RiskModelConstants parsed = new RiskModelConstants(
				readNumber(node, "focus_gamma", 0.0, 10.0, defaults.getFocusGamma()),
				readNumber(node, "min_risk_ratio", 0.0, 1.0, defaults.getMinRiskRatio()),
				readNumber(node, "max_risk_ratio", 1.0, 10.0, defaults.getMaxRiskRatio()),
				readNumber(node, "midpoint_exponent", 1.0, 5.0, defaults.getMidpointExponent()),
				readNumber(node, "max_exponent", 1.0, 5.0, defaults.getMaxExponent()),
				readNumber(node, "conservation_headroom", 0.0, 1.0, defaults.getConservationHeadroom()),
				readNumber(node, "max_high_risk_boost", 0.0, 1.0, defaults.getMaxHighRiskBoost()),
				readNumber(node, "transparency_cap", 0.0, 1.0, defaults.getTransparencyCap()),
				readNumber(node, "effectiveness_cap_base", 0.0, 1.0, defaults.getEffectivenessCapBase()),
				readNumber(node, "effectiveness_cap_range", 0.0, 1.0, defaults.getEffectivenessCapRange()),
				readNumber(node, "residual_floor", 0.0, 1.0, defaults.getResidualFloor()),
				readNumber(node, "rank_gap", 0.0, MAX_PERCENT, defaults.getRankGap())
		);
		List<String> errors = validateConstants(parsed);
		if (!errors.isEmpty()) {
			logger.warn("Inconsistent model constants in {} ({}), using built-in constants",
					defaultsLocation, String.join("; ", errors));
			return defaults;
		}
		return parsed;
	}

	private List<String> validateConstants(RiskModelConstants constants) {
		List<String> errors = new ArrayList<>();
		if (constants == null) {
			return errors;
		}
		if (!(constants.getMinRiskRatio() > 0 && constants.getMinRiskRatio() < constants.getMaxRiskRatio())) {
			errors.add("min_risk_ratio must be positive and below max_risk_ratio");
		}
		if (!(constants.getMidpointExponent() >= 1.0 && constants.getMidpointExponent() <= constants.getMaxExponent())) {
			errors.add("midpoint_exponent must be within [1, max_exponent]");
		}
		if (!(constants.getTransparencyCap() > 0 && constants.getTransparencyCap() <= 1.0)) {
			errors.add("transparency_cap must be within (0, 1]");
		}
		if (!(constants.getEffectivenessCapBase() + constants.getEffectivenessCapRange() <= 1.0)) {
			errors.add("effectiveness_cap_base plus effectiveness_cap_range must not exceed 1");
		}
		if (!inRange(constants.getResidualFloor(), 0.0, 1.0)) {
			errors.add("residual_floor must be within [0, 1]");
		}
		if (!(Double.isFinite(constants.getFocusGamma()) && constants.getFocusGamma() >= 0)) {
			errors.add("focus_gamma must be a non-negative number");
		}
		if (!(Double.isFinite(constants.getRankGap()) && constants.getRankGap() >= 0)) {
			errors.add("rank_gap must be a non-negative number");
		}
		return errors;
	}

	private List<Double> readVector(JsonNode root, String field, int expectedLength, double max, List<Double> fallback) {
		JsonNode node = root.get(field);
		if (node == null || node.isNull()) {
			return fallback;
		}
		if (!node.isArray() || node.size() != expectedLength) {
			logger.warn("Ignoring {} in {}: expected {} numbers", field, defaultsLocation, expectedLength);
			return fallback;
		}
		List<Double> values = new ArrayList<>(expectedLength);
		for (int i = 0; i < node.size(); i++) {
			JsonNode element = node.get(i);
			if (!element.isNumber() || !inRange(element.doubleValue(), 0.0, max)) {
				logger.warn("Ignoring {} in {}: values must be numbers within [0, {}]", field, defaultsLocation, max);
				return fallback;
			}
			values.add(element.doubleValue());
		}
		return List.copyOf(values);
	}

	private double readNumber(JsonNode root, String field, double min, double max, double fallback) {
		JsonNode node = root.get(field);
		if (node == null || node.isNull()) {
			return fallback;
		}
		if (!node.isNumber() || !inRange(node.doubleValue(), min, max)) {
			logger.warn("Ignoring {} in {}: expected a number within [{}, {}]", field, defaultsLocation, min, max);
			return fallback;
		}
		return node.doubleValue();
	}

	private void checkVector(List<String> errors, String field, List<Double> values, int expectedLength, double max) {
		if (values == null || values.size() != expectedLength) {
			errors.add(field + " must have " + expectedLength + " entries");
			return;
		}
		for (Double value : values) {
			if (value == null || !inRange(value, 0.0, max)) {
				errors.add(field + " values must be within [0, " + max + "]");
				return;
			}
		}
	}

	private static boolean inRange(double value, double min, double max) {
		return Double.isFinite(value) && value >= min && value <= max;
	}
}
