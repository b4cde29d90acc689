package com.climbwatch.occupancy.service;

import com.climbwatch.occupancy.config.OccupancyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Works out which GCP project the service runs in.
 *
 * GOOGLE_CLOUD_PROJECT wins; otherwise the GCE metadata server is asked once and the
 * answer is cached. Off GCP the lookup fails and "unknown" is used.
 */
@Service
@Slf4j
public class ProjectIdResolver {

    static final String METADATA_URL = "http://metadata.google.internal/computeMetadata/v1/project/project-id";
    static final String UNKNOWN = "unknown";

    private final OccupancyProperties properties;
    private final RestTemplate metadataRestTemplate;

    private volatile String projectId;

    public ProjectIdResolver(OccupancyProperties properties,
                             @Qualifier("metadataRestTemplate") RestTemplate metadataRestTemplate) {
        this.properties = properties;
        this.metadataRestTemplate = metadataRestTemplate;
    }

    public String resolve() {
        String resolved = projectId;
        if (resolved == null) {
            synchronized (this) {
                if (projectId == null) {
                    projectId = lookup();
                }
                resolved = projectId;
            }
        }
        return resolved;
    }

    private String lookup() {
        String configured = properties.getProjectId();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.set("Metadata-Flavor", "Google");
        try {
            String id = metadataRestTemplate.exchange(METADATA_URL, HttpMethod.GET,
                    new HttpEntity<>(headers), String.class).getBody();
            if (id != null && !id.isBlank()) {
                log.info("Project id {} detected from metadata server", id.trim());
                return id.trim();
            }
        } catch (RestClientException e) {
            log.warn("Unable to detect project id from GOOGLE_CLOUD_PROJECT or metadata server: {}", e.getMessage());
        }
        return UNKNOWN;
    }
}
