package com.chicu.trafficvolume.config;

import com.chicu.trafficvolume.health.ServiceStatusService;
import com.chicu.trafficvolume.ml.ModelProperties;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * OpenAPI document at /openapi.json, Swagger UI at /docs (see application.yml).
 * ReDoc is a static page at /redoc that renders the same document.
 */
@Configuration
public class OpenApiConfig implements WebMvcConfigurer {

    public static final String REDOC_PATH = "/redoc";

    @Bean
    public OpenAPI trafficVolumeOpenAPI(ModelProperties modelProperties) {
        return new OpenAPI()
                .info(new Info()
                        .title(ServiceStatusService.SERVICE_NAME)
                        .version(modelProperties.getVersion())
                        .description("A machine learning API for predicting hourly traffic volume "
                                + "on metropolitan interstate highways."));
    }

    @Override
    public void addViewControllers(ViewControllerRegistry registry) {
        registry.addViewController(REDOC_PATH).setViewName("forward:/redoc.html");
    }
}
