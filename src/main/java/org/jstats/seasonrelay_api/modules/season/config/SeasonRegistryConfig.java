package org.jstats.seasonrelay_api.modules.season.config;

import org.jstats.seasonrelay_api.modules.season.registry.SeasonRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SeasonProperties.class)
public class SeasonRegistryConfig {

    private static final Logger log = LoggerFactory.getLogger(SeasonRegistryConfig.class);

    // A broken catalog fails start-up here
    @Bean
    SeasonRegistry seasonRegistry(SeasonCatalogLoader loader) {
        var registry = new SeasonRegistry(loader.load());
        log.info("Season registry ready: {}", registry);
        return registry;
    }
}
