package com.chicu.trafficvolume.ml;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "traffic.model")
public class ModelProperties {

    /**
     * Spring resource location of the PMML export of the trained pipeline,
     * e.g. file:/opt/models/traffic_model_pipeline.pmml or classpath:models/traffic.pmml
     */
    private String artifactLocation = "file:traffic_model_pipeline.pmml";

    /**
     * Reported as model_version in every prediction.
     */
    private String version = "1.0.0";
}
