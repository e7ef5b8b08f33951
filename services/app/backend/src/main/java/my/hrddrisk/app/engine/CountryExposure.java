package my.hrddrisk.app.engine;

public record CountryExposure(String isoCode,
							  double volume,
							  double risk,
							  double biasedRatio) {
}
