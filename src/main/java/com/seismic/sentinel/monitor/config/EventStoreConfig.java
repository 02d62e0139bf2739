package com.seismic.sentinel.monitor.config;

import com.seismic.sentinel.monitor.core.EventStore;
import com.seismic.sentinel.monitor.core.InMemoryEventStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EventStoreConfig {

    @Bean
    public EventStore eventStore() {
        return new InMemoryEventStore();
    }
}
