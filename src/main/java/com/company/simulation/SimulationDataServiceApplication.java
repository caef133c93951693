package com.company.simulation;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@OpenAPIDefinition(
        info = @Info(
                title = "Simulation Data Service API",
                version = "1.0.0",
                description = "Read-only access to building-energy simulation projects"
        )
)
public class SimulationDataServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SimulationDataServiceApplication.class, args);
    }
}
