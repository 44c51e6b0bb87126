package com.example.collab.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PropertiesConfig {

    @Value("${instance.id:${INSTANCE_ID:${HOSTNAME:collab-session-0}}}")
    private String instanceId;

    @Value("${cluster.name:${CLUSTER_NAME:collab-local}}")
    private String clusterName;

    @Bean
    @ConfigurationProperties(prefix = "collab")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();

        // Identity comes from the environment; everything else binds from collab.*
        properties.setInstanceId(instanceId);
        properties.setClusterName(clusterName);
        return properties;
    }
}
