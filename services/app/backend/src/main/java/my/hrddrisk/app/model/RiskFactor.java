package my.hrddrisk.app.model;

public enum RiskFactor {
	ITUC_RIGHTS_RATING("ITUC Rights Rating"),
	CORRUPTION_INDEX("Corruption Index"),
	MIGRANT_WORKER_PREVALENCE("Migrant Worker Prevalence"),
	WJP_INDEX("WJP Index"),
	WALKFREE_SLAVERY_INDEX("Walk Free Slavery Index");

	private final String label;

	RiskFactor(String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	public static int count() {
		return values().length;
	}
}
