package my.hrddrisk.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HrddRiskApplication {
	public static void main(String[] args) {
		SpringApplication.run(HrddRiskApplication.class, args);
	}
}
