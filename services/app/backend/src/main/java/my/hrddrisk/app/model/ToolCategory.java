package my.hrddrisk.app.model;

public enum ToolCategory {
	WORKER_VOICE("Worker Voice", 1.0),
	AUDIT("Audit", 0.85),
	PASSIVE("Passive", 0.70);

	private final String displayName;
	private final double categoryWeight;

	ToolCategory(String displayName, double categoryWeight) {
		this.displayName = displayName;
		this.categoryWeight = categoryWeight;
	}

	public String getDisplayName() {
		return displayName;
	}

	public double getCategoryWeight() {
		return categoryWeight;
	}
}
