package com.tsrouter;

import com.tsrouter.config.ConfigSource;
import com.tsrouter.config.KeyValueConfigSource;
import com.tsrouter.config.RouterProperties;
import com.tsrouter.model.LineProtocol;
import com.tsrouter.query.QueryRouter;
import com.tsrouter.query.QueryValidator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.io.File;
import java.time.Clock;

/**
 * Routing proxy in front of independent line-protocol time-series backends.
 *
 * Writes are fanned out per measurement to every mapped backend through a
 * per-backend batcher; queries go to one healthy mapped backend, preferring
 * the zone of the node that received them.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ConfigSource configSource(RouterProperties properties) {
        return new KeyValueConfigSource(new File(properties.getConfigFile()));
    }

    @Bean
    public LineProtocol lineProtocol(RouterProperties properties, Clock clock) {
        return new LineProtocol(properties.getWrite().isDefaultTimestamp(), clock);
    }

    @Bean
    public QueryRouter queryRouter(RouterProperties properties) {
        RouterProperties.Query query = properties.getQuery();
        return new QueryRouter(new QueryValidator(query.getForbiddenPatterns(), query.getObligatedPatterns(),
                                                  query.isRequireTimeBound()));
    }
}
