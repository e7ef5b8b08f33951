package my.hrddrisk.app.model;

public enum ResponseLever {
	REALTIME_REMEDY_VISIBILITY("Suppliers see risks and remedy-impact in realtime"),
	BINDING_COMMERCIAL_LEVERS("Binding Commercial Levers"),
	CORRECTIVE_ACTION_PLANS("Corrective Action Plans with quarterly follow-up"),
	SUPPLIER_DEVELOPMENT("Supplier Development Programmes"),
	INDUSTRY_COLLABORATION("Industry Collaboration & Agreements"),
	CRISIS_ONLY_FOLLOW_UP("Follow up only on crisis situations");

	private final String label;

	ResponseLever(String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	public static int count() {
		return values().length;
	}
}
