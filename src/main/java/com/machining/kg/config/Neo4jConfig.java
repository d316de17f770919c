package com.machining.kg.config;

import org.neo4j.driver.Driver;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.neo4j.core.transaction.Neo4jTransactionManager;
import org.springframework.data.neo4j.repository.config.EnableNeo4jRepositories;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Neo4j Configuration
 * Enables Neo4j repositories and transaction management for Spring Data Neo4j 7.x.
 * Loader batches run through {@code batchTransactionTemplate} so each batch commits on its own
 * and is rolled back as a unit when the store goes away.
 */
@Configuration
@EnableNeo4jRepositories(
    basePackages = "com.machining.kg.graph.repository",
    transactionManagerRef = "neo4jTransactionManager"
)
@EnableTransactionManagement
public class Neo4jConfig {

    @Bean(name = {"neo4jTransactionManager", "transactionManager"})
    public PlatformTransactionManager neo4jTransactionManager(Driver driver) {
        return new Neo4jTransactionManager(driver);
    }

    /**
     * One transaction per loader batch, bounded by the configured timeout
     */
    @Bean
    public TransactionTemplate batchTransactionTemplate(
            @Qualifier("neo4jTransactionManager") PlatformTransactionManager transactionManager,
            LoaderProperties loaderProperties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout(loaderProperties.getTransactionTimeoutSeconds());
        return template;
    }

    /**
     * Read-only transactions for traversal and snapshot queries
     */
    @Bean
    public TransactionTemplate readTransactionTemplate(
            @Qualifier("neo4jTransactionManager") PlatformTransactionManager transactionManager,
            LoaderProperties loaderProperties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setReadOnly(true);
        template.setTimeout(loaderProperties.getTransactionTimeoutSeconds());
        return template;
    }
}
