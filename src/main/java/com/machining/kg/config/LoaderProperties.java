package com.machining.kg.config;

import com.machining.kg.dto.LoadMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "machining.loader")
public class LoaderProperties {
    private String processesFile = "classpath:dataset/processes.csv";
    private String toolsFile = "classpath:dataset/tools.csv";
    private int batchSize = 100;
    private char delimiter = ',';
    private int transactionTimeoutSeconds = 30;
    private boolean loadOnStartup = false;
    private LoadMode startupMode = LoadMode.FULL_REBUILD;
    private int maxReportedViolations = 50;
}
