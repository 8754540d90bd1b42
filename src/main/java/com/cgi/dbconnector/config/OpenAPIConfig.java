package com.cgi.dbconnector.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for OpenAPI documentation (Swagger).
 */
@Configuration
public class OpenAPIConfig {

    /**
     * Creates the OpenAPI description of the driver API.
     *
     * @param version Application version
     * @return OpenAPI configuration
     */
    @Bean
    public OpenAPI driverManagerOpenAPI(@Value("${dbconnector.api.version:0.0.1}") String version) {
        return new OpenAPI()
                .info(new Info()
                        .title("JDBC Driver Manager API")
                        .description("Downloads, installs and loads third-party JDBC drivers")
                        .version(version)
                        .license(new License().name("Apache 2.0")));
    }
}
