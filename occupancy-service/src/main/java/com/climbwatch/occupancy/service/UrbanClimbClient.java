package com.climbwatch.occupancy.service;

import com.climbwatch.occupancy.config.OccupancyProperties;
import com.climbwatch.occupancy.model.AttendanceSlot;
import com.climbwatch.occupancy.model.Branch;
import com.climbwatch.occupancy.model.OccupancyReading;
import com.climbwatch.occupancy.model.UrbanClimbOccupancy;
import com.climbwatch.occupancy.model.UrbanClimbTrendSlot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.List;

/**
 * Thin client over the two Urban Climb widget endpoints.
 *
 * Bodies are fetched as text and decoded separately so that an unreachable vendor
 * (FETCH) and an unexpected payload (DECODE) are reported as different failures.
 * Nothing here retries; the caller decides what a failed branch means.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UrbanClimbClient {

    private final RestTemplate upstreamRestTemplate;
    private final ObjectMapper objectMapper;
    private final BranchReadingMapper mapper;
    private final OccupancyProperties properties;

    /**
     * Fetch the live occupancy of a branch.
     *
     * @throws UpstreamException FETCH when the call fails, DECODE when the body is not an occupancy object
     */
    public OccupancyReading fetchOccupancy(Branch branch) {
        String url = properties.getUpstream().getOccupancyUrl() + branch.upstreamId();
        String body = get(branch, url);

        UrbanClimbOccupancy raw = decode(branch, body, UrbanClimbOccupancy.class);
        if (raw.getCurrentPercentage() == null) {
            throw new UpstreamException(UpstreamException.Kind.DECODE, branch,
                    "Occupancy for " + branch.branchName() + " has no CurrentPercentage");
        }
        return mapper.toReading(raw);
    }

    /**
     * Fetch the expected-attendance forecast of a branch.
     *
     * @return exactly {@code expected-slot-count} slots, in vendor order
     * @throws UpstreamException FETCH when the call fails, DECODE when the body is not a full forecast
     */
    public List<AttendanceSlot> fetchExpectedAttendance(Branch branch) {
        String url = properties.getUpstream().getTrendlineUrl() + branch.upstreamId();
        String body = get(branch, url);

        UrbanClimbTrendSlot[] raw = decode(branch, body, UrbanClimbTrendSlot[].class);
        int expected = properties.getUpstream().getExpectedSlotCount();
        if (raw.length != expected) {
            throw new UpstreamException(UpstreamException.Kind.DECODE, branch,
                    String.format("Expected %d attendance slots for %s but got %d",
                            expected, branch.branchName(), raw.length));
        }
        for (UrbanClimbTrendSlot slot : raw) {
            if (slot == null || slot.getHour() == null || slot.getPercentage() == null) {
                throw new UpstreamException(UpstreamException.Kind.DECODE, branch,
                        "Attendance forecast for " + branch.branchName() + " has a slot without hour or percentage");
            }
            if (slot.getHour() < 0 || slot.getHour() > 23) {
                throw new UpstreamException(UpstreamException.Kind.DECODE, branch,
                        "Attendance forecast for " + branch.branchName() + " has hour " + slot.getHour());
            }
        }
        return Arrays.stream(raw).map(mapper::toSlot).toList();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String get(Branch branch, String url) {
        log.debug("Calling Urban Climb API: {}", url);
        try {
            String body = upstreamRestTemplate.getForObject(url, String.class);
            if (body == null || body.isBlank()) {
                throw new UpstreamException(UpstreamException.Kind.DECODE, branch,
                        "Empty response for " + branch.branchName());
            }
            return body;
        } catch (RestClientException e) {
            log.error("API call failed for {} ({}): {}", branch.branchName(), url, e.getMessage());
            throw new UpstreamException(UpstreamException.Kind.FETCH, branch,
                    "Fetch failed for " + branch.branchName() + ": " + e.getMessage(), e);
        }
    }

    private <T> T decode(Branch branch, String body, Class<T> type) {
        try {
            T value = objectMapper.readValue(body, type);
            if (value == null) {
                throw new UpstreamException(UpstreamException.Kind.DECODE, branch,
                        "Null payload for " + branch.branchName());
            }
            return value;
        } catch (JsonProcessingException e) {
            log.error("Could not decode response for {}: {}", branch.branchName(), e.getOriginalMessage());
            throw new UpstreamException(UpstreamException.Kind.DECODE, branch,
                    "Malformed response for " + branch.branchName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
