package com.waypoint.loadtest;

import io.gatling.javaapi.core.*;
import io.gatling.javaapi.http.*;

import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Random;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static io.gatling.javaapi.core.CoreDsl.*;
import static io.gatling.javaapi.http.HttpDsl.*;

/**
 * Routing Failover Simulation: request routing decisions from several source countries and
 * report real-traffic outcomes back, with a failure share high enough to trip breakers.
 * A second scenario polls breaker and health status while decisions keep flowing, so the
 * report shows decisions moving to fallback regions and back once breakers close.
 */
public class RoutingFailoverSimulation extends Simulation {

    private static final String BASE_URL = System.getProperty("gatling.baseUrl", "http://localhost:8080");
    private static final String API_KEY = System.getProperty("gatling.apiKey", "load-test-key");
    private static final double FAILURE_RATE = Double.parseDouble(System.getProperty("gatling.failureRate", "0.2"));

    private final HttpProtocolBuilder httpProtocol = http
            .baseUrl(BASE_URL)
            .header("Authorization", "Bearer " + API_KEY)
            .acceptHeader("application/json")
            .shareConnections();

    private static final String[] COUNTRIES = {"US", "CA", "DE", "AT", "GB", "FR", "SG", "JP"};
    private static final String[] CAPABILITIES = {"inference", "inference", "storage", "training"};
    private static final Random RANDOM = new Random();

    private Iterator<Map<String, Object>> decisionFeeder() {
        return Stream.generate(
                (Supplier<Map<String, Object>>) () -> Map.of(
                        "country", COUNTRIES[RANDOM.nextInt(COUNTRIES.length)],
                        "capability", CAPABILITIES[RANDOM.nextInt(CAPABILITIES.length)],
                        "outcome", RANDOM.nextDouble() < FAILURE_RATE ? "failure" : "success"
                )
        ).iterator();
    }

    private final ScenarioBuilder routing = scenario("Routing Decisions with Feedback")
            .feed(decisionFeeder())
            .exec(
                    http("Routing Decision")
                            .get("/api/v1/routing/decision")
                            .queryParam("country", "#{country}")
                            .queryParam("capability", "#{capability}")
                            .check(status().in(200, 503))
                            .check(jsonPath("$.regionId").optional().saveAs("regionId"))
            )
            .pause(Duration.ofMillis(20), Duration.ofMillis(100))
            .doIf(session -> session.contains("regionId")).then(
                    exec(
                            http("Report #{outcome}")
                                    .post("/api/v1/routing/regions/#{regionId}/#{outcome}")
                                    .check(status().is(202))
                    )
            );

    private final ScenarioBuilder statusPolling = scenario("Breaker and Health Polling")
            .exec(
                    http("Circuit Breakers")
                            .get("/api/v1/regions/status/circuit-breakers")
                            .check(status().is(200))
            )
            .pause(Duration.ofMillis(500))
            .exec(
                    http("Region Health")
                            .get("/api/v1/regions/status/health")
                            .check(status().is(200))
            );

    {
        setUp(
                routing.injectOpen(
                        rampUsersPerSec(5).to(300).during(Duration.ofSeconds(20)),
                        constantUsersPerSec(300).during(Duration.ofMinutes(3))
                ),
                statusPolling.injectOpen(
                        constantUsersPerSec(2).during(Duration.ofMinutes(3))
                )
        ).protocols(httpProtocol)
         .assertions(
                 global().failedRequests().percent().lt(1.0),
                 details("Routing Decision").responseTime().percentile(95.0).lt(50)
         );
    }
}
