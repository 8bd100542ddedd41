package com.airforecast.config;

import com.airforecast.store.ArtifactStore;
import com.airforecast.store.FileSystemArtifactStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class EngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ArtifactStore artifactStore(ForecastProperties properties) {
        return new FileSystemArtifactStore(Path.of(properties.getRegistry().getDirectory()));
    }

    /** Runs predictions so callers can bound them with a timeout. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService predictionExecutor(@Value("${forecast.prediction.pool-size:4}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(1, poolSize));
    }
}
