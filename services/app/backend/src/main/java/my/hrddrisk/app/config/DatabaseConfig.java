package my.hrddrisk.app.config;

import liquibase.integration.spring.SpringLiquibase;
import my.hrddrisk.app.catalog.JdbcCountryCatalog;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.DatabaseStartupValidator;

import javax.sql.DataSource;

/**
 * Primary country store. Disabled with {@code hrdd.catalog.jdbc-enabled=false}, in which case the catalog runs
 * on the bundled country file alone.
 */
@Configuration
@ConditionalOnProperty(prefix = "hrdd.catalog", name = "jdbc-enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(DatabaseConfig.SchemaSettings.class)
public class DatabaseConfig {
	static final String DEFAULT_CHANGE_LOG = "classpath:db/changelog/db.changelog-master.yaml";

	@Bean
	public DatabaseStartupValidator databaseStartupValidator(DataSource dataSource) {
		DatabaseStartupValidator validator = new DatabaseStartupValidator();
		validator.setDataSource(dataSource);
		validator.setTimeout(60);
		validator.setInterval(5);
		return validator;
	}

	@Bean
	@DependsOn("databaseStartupValidator")
	public SpringLiquibase liquibase(DataSource dataSource, SchemaSettings settings) {
		SpringLiquibase liquibase = new SpringLiquibase();
		liquibase.setDataSource(dataSource);
		liquibase.setChangeLog(resolveChangeLog(settings));
		liquibase.setShouldRun(settings.isEnabled());
		return liquibase;
	}

	@Bean
	@DependsOn("liquibase")
	public JdbcCountryCatalog jdbcCountryCatalog(JdbcTemplate jdbcTemplate) {
		return new JdbcCountryCatalog(jdbcTemplate);
	}

	static String resolveChangeLog(SchemaSettings settings) {
		String changeLog = settings == null ? null : settings.getChangeLog();
		if (changeLog == null || changeLog.isBlank()) {
			return DEFAULT_CHANGE_LOG;
		}
		return changeLog;
	}

	@ConfigurationProperties(prefix = "spring.liquibase")
	public static class SchemaSettings {
		private String changeLog;
		private boolean enabled = true;

		public String getChangeLog() {
			return changeLog;
		}

		public void setChangeLog(String changeLog) {
			this.changeLog = changeLog;
		}

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}
	}
}
