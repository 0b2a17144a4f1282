package com.example.matchscore.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;

@Configuration
@ConditionalOnProperty(name = "matchscore.store", havingValue = "mongo", matchIfMissing = true)
@EnableReactiveMongoRepositories(basePackages = "com.example.matchscore.repo")
public class MongoConfig {
}
