package com.seismic.sentinel.monitor.config;

import com.seismic.sentinel.monitor.service.pipeline.PercentileWindow;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    @Qualifier("cycleDurationWindow")
    public PercentileWindow cycleDurationWindow() {
        return new PercentileWindow(512);
    }
}
