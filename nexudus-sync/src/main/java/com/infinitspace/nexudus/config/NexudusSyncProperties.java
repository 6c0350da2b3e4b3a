package com.infinitspace.nexudus.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "nexudus")
@Data
public class NexudusSyncProperties {

    private Api api = new Api();
    private Auth auth = new Auth();
    private Store store = new Store();
    private Bronze bronze = new Bronze();
    private Snapshot snapshot = new Snapshot();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Api {
        private String baseUrl = "https://spaces.nexudus.com/api";
        private int pageSize = 100;
        /** Account-level rate limits are shared by every caller, so this bounds the whole process. */
        private int maxConcurrentRequests = 3;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
        private int fanOutThreads = 8;
        private Retry retry = new Retry();

        @Data
        public static class Retry {
            private int maxAttempts = 5;
            private Duration initialBackoff = Duration.ofSeconds(4);
            private Duration maxBackoff = Duration.ofSeconds(60);
            /** Wait applied to a 429 that carries no Retry-After header. */
            private Duration defaultRetryAfter = Duration.ofSeconds(15);
        }
    }

    @Data
    public static class Auth {
        private String tokenUrl = "https://spaces.nexudus.com/api/token";
        /** Static token for dev/test; takes priority over the password grant. */
        private String bearerToken;
        private String username;
        private String password;
    }

    @Data
    public static class Store {
        private int loginRetryAttempts = 3;
        private Duration loginRetryDelay = Duration.ofSeconds(5);
    }

    @Data
    public static class Bronze {
        private int batchSize = 100;
    }

    @Data
    public static class Snapshot {
        private boolean enabled = false;
        private String outputDir = "/data/snapshots";
    }

    @Data
    public static class Scheduling {
        private String bronzeCron = "0 0 2 * * *";
        private String silverCron = "0 30 2 * * *";
        private boolean runOnStartup = false;
    }
}
