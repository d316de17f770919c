package com.machining.kg.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "machining.index")
public class IndexProperties {
    private String cacheDir = "./kg-cache";
    private boolean persist = true;
    private boolean rebuildAfterLoad = true;
}
