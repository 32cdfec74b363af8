package ru.petrov.crm_bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import ru.petrov.crm_bridge.config.CrmConfig;
import ru.petrov.crm_bridge.config.SchemaConfig;

@SpringBootApplication
@EnableConfigurationProperties({CrmConfig.class, SchemaConfig.class})
public class CrmBridgeApplication {

	public static void main(String[] args) {
		SpringApplication.run(CrmBridgeApplication.class, args);
	}

}
