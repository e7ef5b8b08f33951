package my.hrddrisk.app.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "hrdd")
public record AppProperties(
		Catalog catalog,
		Engine engine
) {
	public record Catalog(
			@NotBlank String countryFile,
			boolean seedOnStartup,
			boolean jdbcEnabled
	) {
	}

	public record Engine(
			@NotBlank String defaultsResource
	) {
	}
}
