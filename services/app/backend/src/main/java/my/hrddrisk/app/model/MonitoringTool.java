package my.hrddrisk.app.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Transparency tools in strategy-vector order. Each tool belongs to exactly one category and carries the
 * base detection rate that is averaged with the user's own assumption.
 */
public enum MonitoringTool {
	CONTINUOUS_WORKER_VOICE("Continuous Worker Voice", ToolCategory.WORKER_VOICE, 0.90),
	WORKER_SURVEYS("Worker Surveys (annual)", ToolCategory.WORKER_VOICE, 0.45),
	UNANNOUNCED_AUDITS("Unannounced Social Audits", ToolCategory.AUDIT, 0.25),
	ANNOUNCED_AUDITS("Announced Social Audits", ToolCategory.AUDIT, 0.15),
	SUPPLIER_SELF_REPORTING("Supplier Self-Reporting", ToolCategory.PASSIVE, 0.12),
	DESK_BASED_ASSESSMENT("Desk-Based Risk Assessment", ToolCategory.PASSIVE, 0.05);

	private final String label;
	private final ToolCategory category;
	private final double baseEffectiveness;

	MonitoringTool(String label, ToolCategory category, double baseEffectiveness) {
		this.label = label;
		this.category = category;
		this.baseEffectiveness = baseEffectiveness;
	}

	public String getLabel() {
		return label;
	}

	public ToolCategory getCategory() {
		return category;
	}

	public double getBaseEffectiveness() {
		return baseEffectiveness;
	}

	public static int count() {
		return values().length;
	}

	public static List<MonitoringTool> ofCategory(ToolCategory category) {
		List<MonitoringTool> tools = new ArrayList<>();
		for (MonitoringTool tool : values()) {
			if (tool.category == category) {
				tools.add(tool);
			}
		}
		return List.copyOf(tools);
	}
}
