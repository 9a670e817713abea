package com.marketobserver.app;

import com.marketobserver.app.properties.ObserverProperties;
import com.marketobserver.config.Config;
import com.marketobserver.runner.ObservationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(ObserverProperties.class)
public class MarketObserverBootstrapConfig {

    @Bean
    public Config marketObserverConfig(ObserverProperties properties) {
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return toConfig(workingDir, properties);
    }

    @Bean
    @Lazy
    public ObservationRunner observationRunner(Config config) {
        return ObservationRunner.create(config, Clock.system(config.zone()));
    }

    static Config toConfig(Path workingDir, ObserverProperties properties) {
        ObserverProperties p = properties == null ? new ObserverProperties() : properties;
        Map<String, Object> raw = new LinkedHashMap<>();
        putIfNotBlank(raw, "app.zone", p.getZone());
        putIfNotBlank(raw, "outputs.dir", p.getOutputsDir());
        putIfNotBlank(raw, "history.path", p.getHistory() == null ? null : p.getHistory().getPath());
        putIfNotBlank(raw, "keywords.path", p.getKeywords() == null ? null : p.getKeywords().getPath());
        return Config.fromConfigurationProperties(workingDir, raw);
    }

    private static void putIfNotBlank(Map<String, Object> raw, String key, String value) {
        if (value == null || value.trim().isEmpty()) {
            return;
        }
        raw.put(key, value.trim());
    }
}
