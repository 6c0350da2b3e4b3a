package com.infinitspace.nexudus.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.infinitspace.nexudus.config.NexudusSyncProperties;
import com.infinitspace.nexudus.exception.NexudusAuthException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Nexudus bearer tokens via the OAuth password grant, cached until shortly before expiry.
 *
 * A static token from configuration wins over the password grant (local runs, tests);
 * it is never refreshed.
 */
@Service
@Slf4j
public class NexudusTokenProvider implements CredentialProvider {

    static final long DEFAULT_EXPIRES_IN_SECONDS = 20159;
    private static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);

    private final RestTemplate restTemplate;
    private final NexudusSyncProperties.Auth auth;
    private final Clock clock;

    private String cachedToken;
    private Instant expiresAt = Instant.MIN;

    public NexudusTokenProvider(RestTemplate restTemplate, NexudusSyncProperties properties, Clock clock) {
        this.restTemplate = restTemplate;
        this.auth = properties.getAuth();
        this.clock = clock;
    }

    @Override
    public synchronized String getToken() {
        if (StringUtils.hasText(auth.getBearerToken())) {
            return auth.getBearerToken();
        }
        if (cachedToken != null && clock.instant().isBefore(expiresAt)) {
            return cachedToken;
        }
        return requestToken();
    }

    @Override
    public synchronized void invalidate() {
        cachedToken = null;
        expiresAt = Instant.MIN;
    }

    private String requestToken() {
        if (!StringUtils.hasText(auth.getUsername()) || !StringUtils.hasText(auth.getPassword())) {
            throw new NexudusAuthException(
                    "No Nexudus credentials: set NEXUDUS_BEARER_TOKEN or NEXUDUS_USERNAME/NEXUDUS_PASSWORD");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "password");
        form.add("username", auth.getUsername());
        form.add("password", auth.getPassword());

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange(auth.getTokenUrl(), HttpMethod.POST,
                    new HttpEntity<>(form, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw new NexudusAuthException("Nexudus token request failed: " + e.getMessage(), e);
        }

        JsonNode body = response.getBody();
        String token = body == null ? null : body.path("access_token").asText(null);
        if (!StringUtils.hasText(token)) {
            throw new NexudusAuthException("Nexudus token response had no access_token");
        }

        long expiresIn = body.path("expires_in").asLong(DEFAULT_EXPIRES_IN_SECONDS);
        cachedToken = token;
        expiresAt = clock.instant().plusSeconds(expiresIn).minus(EXPIRY_MARGIN);
        log.info("Obtained Nexudus token, valid for {}s", expiresIn);
        return token;
    }
}
