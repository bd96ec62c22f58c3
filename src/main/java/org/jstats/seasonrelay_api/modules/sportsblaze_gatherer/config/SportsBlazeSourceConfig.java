package org.jstats.seasonrelay_api.modules.sportsblaze_gatherer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@ConfigurationProperties(prefix = "sportsblaze.api")
record SportsBlazeSourceProperties(
        String baseUrl,
        String key,
        @DurationUnit(ChronoUnit.MILLIS) Duration connectTimeout,
        @DurationUnit(ChronoUnit.MILLIS) Duration readTimeout,
        String userAgent) {}

@Configuration
@EnableConfigurationProperties(SportsBlazeSourceProperties.class)
public class SportsBlazeSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(SportsBlazeSourceConfig.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("^\\$\\{([^}]+)}$");
    private static final String DEFAULT_KEY_VAR = "SPORTSBLAZE_API_KEY";
    private static volatile String lastSource = null; // for diagnostics only

    static String resolveApiKey(String configured) {
        lastSource = null;
        // Spring already resolved it
        if (StringUtils.hasText(configured) && !configured.startsWith("${")) {
            lastSource = "spring-property";
            return configured;
        }
        String var = DEFAULT_KEY_VAR;
        if (StringUtils.hasText(configured)) {
            Matcher m = PLACEHOLDER.matcher(configured.trim());
            if (m.matches()) {
                var = m.group(1);
                // Support formats like ENV:NAME or just NAME
                int colon = var.indexOf(':');
                if (colon >= 0) {
                    var = var.substring(colon + 1);
                }
            }
        }
        String fromSysProp = System.getProperty(var);
        if (StringUtils.hasText(fromSysProp)) {
            lastSource = "system-property:" + var;
            return fromSysProp;
        }
        fromSysProp = System.getProperty("sportsblaze.api.key");
        if (StringUtils.hasText(fromSysProp)) {
            lastSource = "system-property:sportsblaze.api.key";
            return fromSysProp;
        }
        String fromEnv = System.getenv(var);
        if (StringUtils.hasText(fromEnv)) {
            lastSource = "env:" + var;
            return fromEnv;
        }
        return null;
    }

    static String lookupVariable(String name) {
        String value = System.getProperty(name);
        return StringUtils.hasText(value) ? value : System.getenv(name);
    }

    @Bean
    SportsBlazeCredentials sportsBlazeCredentials(SportsBlazeSourceProperties p) {
        var credentials = SportsBlazeCredentials.resolve(resolveApiKey(p.key()), SportsBlazeSourceConfig::lookupVariable);
        if (credentials.isEmpty()) {
            throw new IllegalStateException("SportsBlaze API key missing. Provide via: 1) application property sportsblaze.api.key, 2) JVM system property -DSPORTSBLAZE_API_KEY=..., 3) environment variable SPORTSBLAZE_API_KEY, or 4) a sport-specific <SPORT>_API_KEY such as WNBA_API_KEY.");
        }
        log.info("SportsBlaze shared API key resolved from {}", lastSource == null ? "nowhere (sport keys only)" : lastSource);
        return credentials;
    }

    @Bean(name = "sportsblaze")
    RestClient sportsBlazeRestClient(RestClient.Builder builder, SportsBlazeSourceProperties p) {
        // Connect timeout lives on the JDK HttpClient, read timeout on the Spring factory
        var httpClientBuilder = HttpClient.newBuilder();
        if (p.connectTimeout() != null) {
            httpClientBuilder.connectTimeout(p.connectTimeout());
        }
        final var factory = new JdkClientHttpRequestFactory(httpClientBuilder.build());
        if (p.readTimeout() != null) {
            factory.setReadTimeout(p.readTimeout());
        }

        var baseUrl = StringUtils.hasText(p.baseUrl()) ? p.baseUrl() : "https://api.sportsblaze.com/v1";
        var userAgent = StringUtils.hasText(p.userAgent()) ? p.userAgent() : "season-relay-api";
        return builder
                .baseUrl(baseUrl)
                .requestFactory(factory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .build();
    }
}
