package com.climbwatch.occupancy.service;

import com.climbwatch.occupancy.config.OccupancyProperties;
import com.climbwatch.occupancy.model.AttendanceSlot;
import com.climbwatch.occupancy.model.Branch;
import com.climbwatch.occupancy.model.OccupancyReading;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("UrbanClimbClient unit tests")
class UrbanClimbClientTest {

    private OccupancyProperties properties;
    private MockRestServiceServer server;
    private UrbanClimbClient client;

    @BeforeEach
    void setUp() {
        properties = new OccupancyProperties();
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new UrbanClimbClient(restTemplate, new ObjectMapper(),
                new BranchReadingMapper(properties), properties);
    }

    private String occupancyUrl(Branch branch) {
        return properties.getUpstream().getOccupancyUrl() + branch.upstreamId();
    }

    private String trendlineUrl(Branch branch) {
        return properties.getUpstream().getTrendlineUrl() + branch.upstreamId();
    }

    static String trendJson(int count, double base) {
        return IntStream.range(0, count)
                .mapToObj(i -> String.format(Locale.ROOT, "{\"hour\":%d,\"percantage\":%.1f,\"remaining\":%.1f}",
                        6 + i, base + i, 100 - base - i))
                .collect(Collectors.joining(",", "[", "]"));
    }

    @Test
    @DisplayName("occupancy JSON decodes into a reading with the vendor values")
    void fetchOccupancy_Success() {
        // given
        server.expect(requestTo(occupancyUrl(Branch.WESTEND)))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"LastUpdated":"2024-05-01T09:30:00+10:00","Name":"West End",
                         "Status":"Quiet","CurrentPercentage":42.5,"Capacity":120}
                        """, MediaType.APPLICATION_JSON));

        // when
        OccupancyReading reading = client.fetchOccupancy(Branch.WESTEND);

        // then
        assertThat(reading.getCurrentPercentage()).isEqualTo(42.5);
        assertThat(reading.getStatus()).isEqualTo("Quiet");
        assertThat(reading.getName()).isEqualTo("West End");
        assertThat(reading.getLastUpdated()).isNotNull();
        server.verify();
    }

    @Test
    @DisplayName("malformed occupancy JSON is a DECODE failure")
    void fetchOccupancy_Malformed() {
        server.expect(requestTo(occupancyUrl(Branch.MILTON)))
                .andRespond(withSuccess("{\"Status\": \"Qui", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchOccupancy(Branch.MILTON))
                .isInstanceOf(UpstreamException.class)
                .extracting("kind").isEqualTo(UpstreamException.Kind.DECODE);
    }

    @Test
    @DisplayName("an object without CurrentPercentage is a DECODE failure")
    void fetchOccupancy_MissingPercentage() {
        server.expect(requestTo(occupancyUrl(Branch.MILTON)))
                .andRespond(withSuccess("{\"Name\":\"Milton\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchOccupancy(Branch.MILTON))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("CurrentPercentage");
    }

    @Test
    @DisplayName("a 5xx answer is a FETCH failure")
    void fetchOccupancy_ServerError() {
        server.expect(requestTo(occupancyUrl(Branch.NEWSTEAD))).andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchOccupancy(Branch.NEWSTEAD))
                .isInstanceOf(UpstreamException.class)
                .extracting("kind").isEqualTo(UpstreamException.Kind.FETCH);
    }

    @Test
    @DisplayName("a timeout is a FETCH failure naming the branch")
    void fetchOccupancy_Timeout() {
        server.expect(requestTo(occupancyUrl(Branch.NEWSTEAD)))
                .andRespond(request -> {
                    throw new SocketTimeoutException("Read timed out");
                });

        assertThatThrownBy(() -> client.fetchOccupancy(Branch.NEWSTEAD))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("newstead")
                .extracting("kind").isEqualTo(UpstreamException.Kind.FETCH);
    }

    @Test
    @DisplayName("16 trend entries decode in order, misspelt field included")
    void fetchExpectedAttendance_Success() {
        // given
        server.expect(requestTo(trendlineUrl(Branch.WESTEND)))
                .andRespond(withSuccess(trendJson(16, 10.0), MediaType.APPLICATION_JSON));

        // when
        List<AttendanceSlot> slots = client.fetchExpectedAttendance(Branch.WESTEND);

        // then
        assertThat(slots).hasSize(16);
        assertThat(slots.get(0).getHour()).isEqualTo(6);
        assertThat(slots.get(0).getPercentage()).isEqualTo(10.0);
        assertThat(slots.get(15).getHour()).isEqualTo(21);
        assertThat(slots.get(15).getPercentage()).isEqualTo(25.0);
        assertThat(slots.get(15).getRemaining()).isEqualTo(75.0);
    }

    @Test
    @DisplayName("the wrong number of trend entries is a DECODE failure")
    void fetchExpectedAttendance_WrongCount() {
        server.expect(requestTo(trendlineUrl(Branch.MILTON)))
                .andRespond(withSuccess(trendJson(15, 10.0), MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchExpectedAttendance(Branch.MILTON))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("Expected 16")
                .extracting("kind").isEqualTo(UpstreamException.Kind.DECODE);
    }

    @Test
    @DisplayName("trend entries without hour or percentage are a DECODE failure, not zero slots")
    void fetchExpectedAttendance_UnrecognisedFields() {
        // given
        String body = IntStream.range(0, 16)
                .mapToObj(i -> "{\"Hour\":" + (6 + i) + ",\"Pct\":50}")
                .collect(Collectors.joining(",", "[", "]"));
        server.expect(requestTo(trendlineUrl(Branch.WESTEND)))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        // when / then
        assertThatThrownBy(() -> client.fetchExpectedAttendance(Branch.WESTEND))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("without hour or percentage")
                .extracting("kind").isEqualTo(UpstreamException.Kind.DECODE);
    }

    @Test
    @DisplayName("a trend entry missing only its percentage is a DECODE failure")
    void fetchExpectedAttendance_MissingPercentage() {
        String body = trendJson(15, 10.0).replace("]", ",{\"hour\":21,\"remaining\":40.0}]");
        server.expect(requestTo(trendlineUrl(Branch.MILTON)))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchExpectedAttendance(Branch.MILTON))
                .isInstanceOf(UpstreamException.class)
                .extracting("kind").isEqualTo(UpstreamException.Kind.DECODE);
    }

    @Test
    @DisplayName("an hour outside 0-23 is a DECODE failure")
    void fetchExpectedAttendance_HourOutOfRange() {
        String body = trendJson(15, 10.0).replace("]", ",{\"hour\":24,\"percantage\":5.0}]");
        server.expect(requestTo(trendlineUrl(Branch.NEWSTEAD)))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchExpectedAttendance(Branch.NEWSTEAD))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("hour 24")
                .extracting("kind").isEqualTo(UpstreamException.Kind.DECODE);
    }

    @Test
    @DisplayName("an object where an array is expected is a DECODE failure")
    void fetchExpectedAttendance_WrongShape() {
        server.expect(requestTo(trendlineUrl(Branch.MILTON)))
                .andRespond(withSuccess("{\"hour\":6}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchExpectedAttendance(Branch.MILTON))
                .isInstanceOf(UpstreamException.class)
                .extracting("kind").isEqualTo(UpstreamException.Kind.DECODE);
    }

    @Test
    @DisplayName("an empty body is a DECODE failure")
    void fetchExpectedAttendance_EmptyBody() {
        server.expect(requestTo(trendlineUrl(Branch.NEWSTEAD)))
                .andRespond(withSuccess("", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchExpectedAttendance(Branch.NEWSTEAD))
                .isInstanceOf(UpstreamException.class)
                .extracting("kind").isEqualTo(UpstreamException.Kind.DECODE);
    }
}
