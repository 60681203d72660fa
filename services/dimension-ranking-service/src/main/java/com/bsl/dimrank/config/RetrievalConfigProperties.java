package com.bsl.dimrank.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dimrank.config")
public class RetrievalConfigProperties {
    private String path = "config/dimension_retrieval_config.yaml";

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
