package com.example.docs.config;

import com.example.docs.config.convert.StoredCodeConverters;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableReactiveMongoAuditing;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;

@Configuration
@EnableReactiveMongoRepositories(basePackages = {
        "com.example.docs.access.repository",
        "com.example.docs.workspace.repository",
        "com.example.docs.document.repository",
        "com.example.docs.wiki.repository",
        "com.example.docs.collection.repository",
        "com.example.docs.version.repository",
        "com.example.docs.comment.repository"
})
@EnableReactiveMongoAuditing
public class MongoConfig {
    // Indexes declared on the documents are created when spring.data.mongodb.auto-index-creation is on

    @Bean
    public MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(StoredCodeConverters.all());
    }
}
