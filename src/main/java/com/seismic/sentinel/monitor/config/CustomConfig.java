package com.seismic.sentinel.monitor.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.seismic.sentinel.monitor.common.constants.FeedConstants;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class CustomConfig {

    /**
     * Feed template. Connect and per-read timeouts use the fetch timeout; the whole exchange is bounded by
     * {@link com.seismic.sentinel.monitor.service.feed.UsgsFeedClient}.
     */
    @Bean
    public RestTemplate feedRestTemplate(RestTemplateBuilder builder, MonitorProperties props) {
        return builder
                .setConnectTimeout(props.getFetchTimeout())
                .setReadTimeout(props.getFetchTimeout())
                .defaultHeader("User-Agent", FeedConstants.USER_AGENT)
                .build();
    }

    /**
     * Worker for feed downloads, so the caller can give up on a fetch at the deadline. A second worker covers
     * the tick after an abandoned fetch while the first one is still closing its connection.
     */
    @Bean(name = "feedFetchExecutor")
    public ThreadPoolTaskExecutor feedFetchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("FeedFetch-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    @Primary
    public ObjectMapper mapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
