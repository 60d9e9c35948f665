package com.shlokmestry.guard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app")
public record AppProps(
        String mode
) {
    public DeploymentMode deploymentMode() {
        return DeploymentMode.of(mode);
    }
}
