package com.infinitspace.nexudus.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
@RequiredArgsConstructor
public class UpstreamClientConfig {

    private final NexudusSyncProperties properties;

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        NexudusSyncProperties.Api api = properties.getApi();
        return builder
                .setConnectTimeout(api.getConnectTimeout())
                .setReadTimeout(api.getReadTimeout())
                .build();
    }

    /**
     * Threads for the per-resource fetch fan-out. Upstream concurrency is capped
     * separately by the client's bulkhead.
     */
    @Bean(name = "resourceFetchExecutor")
    public Executor resourceFetchExecutor() {
        int threads = properties.getApi().getFanOutThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("resource-fetch-");
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
