package com.typepulse.processing.config;

import com.typepulse.anomaly.detection.AntiCheatValidator;
import com.typepulse.processing.report.ReportAssembler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AnalyticsConfig {

    @Bean
    public ReportAssembler reportAssembler(AntiCheatValidator antiCheatValidator) {
        return new ReportAssembler(antiCheatValidator);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService analyticsExecutor(@Value("${typepulse.analytics.executor-threads:2}") int threads) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("typepulse-analytics-");
        factory.setDaemon(true);
        return Executors.newFixedThreadPool(Math.max(1, threads), factory);
    }
}
