package com.elssolution.vuegraf.integration.emporia;

import com.elssolution.vuegraf.config.VuegrafProperties;
import com.elssolution.vuegraf.domain.Channel;
import com.elssolution.vuegraf.domain.Device;
import com.elssolution.vuegraf.domain.Scale;
import com.elssolution.vuegraf.domain.UsageSeries;
import com.elssolution.vuegraf.integration.http.RetryingHttp;
import com.elssolution.vuegraf.integration.http.UpstreamException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmporiaCloudClientTest {

    private HttpServer server;
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger appApiFailures = new AtomicInteger();
    private EmporiaCloudClient client;

    @BeforeEach
    void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/customers/devices", ex -> respond(ex, 200,
                "{\"devices\":[{\"deviceGid\":100,\"channels\":[{\"channelNum\":\"1,2,3\"}]}]}"));
        server.createContext("/devices/100/locationProperties", ex -> respond(ex, 200, "{\"deviceName\":\"Panel\"}"));
        server.createContext("/AppAPI", ex -> {
            if (appApiFailures.getAndDecrement() > 0) {
                respond(ex, 503, "busy");
                return;
            }
            String query = ex.getRequestURI().getQuery();
            if (query.contains("apiMethod=getChartUsage")) {
                respond(ex, 200, "{\"firstUsageInstant\":\"2024-03-10T11:00:00Z\",\"usageList\":[0.01,null]}");
            } else {
                respond(ex, 200, "{\"deviceListUsages\":{\"devices\":[{\"deviceGid\":100,\"channelUsages\":"
                        + "[{\"deviceGid\":100,\"channelNum\":\"1,2,3\",\"usage\":0.01}]}]}}");
            }
        });
        server.start();

        RetryingHttp http = new RetryingHttp(HttpClient.newHttpClient(), "Emporia", new int[]{10, 10});
        client = new EmporiaCloudClient(http, new EmporiaJson(new ObjectMapper()),
                "http://127.0.0.1:" + server.getAddress().getPort() + "/", "id-token", Duration.ofSeconds(5));
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void respond(HttpExchange ex, int status, String body) throws IOException {
        // path plus decoded query
        requests.add(ex.getRequestURI().getPath() + "?" + ex.getRequestURI().getQuery()
                + " authtoken=" + ex.getRequestHeaders().getFirst("authtoken"));
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void list_devices_resolves_each_device_name() throws Exception {
        List<Device> devices = client.listDevices();

        assertThat(devices).singleElement().satisfies(d -> {
            assertThat(d.gid()).isEqualTo(100L);
            assertThat(d.name()).isEqualTo("Panel");
        });
        assertThat(requests).allSatisfy(r -> assertThat(r).endsWith("authtoken=id-token"));
    }

    @Test
    void device_list_usage_query() throws Exception {
        Map<Long, Device> usage = client.getDeviceListUsage(List.of(100L, 200L),
                Instant.parse("2024-03-10T12:00:00.750Z"), Scale.MINUTE);

        assertThat(usage.get(100L).channels().get(0).usage()).isEqualTo(0.01);
        assertThat(requests).singleElement().satisfies(r -> assertThat(r).contains(
                "apiMethod=getDeviceListUsages", "deviceGids=100+200",
                "instant=2024-03-10T12:00:00Z", "scale=1MIN", "energyUnit=KilowattHours"));
    }

    @Test
    void chart_usage_query() throws Exception {
        Channel chan = new Channel(100L, "1,2,3", "Panel", null, List.of());

        UsageSeries series = client.getChartUsage(chan, Instant.parse("2024-03-10T11:00:00Z"),
                Instant.parse("2024-03-10T12:00:00Z"), Scale.SECOND);

        assertThat(series.samples()).containsExactly(0.01, null);
        assertThat(requests).singleElement().satisfies(r -> assertThat(r).contains(
                "apiMethod=getChartUsage", "deviceGid=100", "channel=1,2,3",
                "start=2024-03-10T11:00:00Z", "end=2024-03-10T12:00:00Z", "scale=1S"));
    }

    @Test
    void server_errors_are_retried() throws Exception {
        appApiFailures.set(2);

        Map<Long, Device> usage = client.getDeviceListUsage(List.of(100L), Instant.EPOCH, Scale.MINUTE);

        assertThat(usage).containsKey(100L);
        assertThat(requests).hasSize(3);
    }

    @Test
    void server_errors_give_up_after_the_last_retry() {
        appApiFailures.set(5);

        assertThatThrownBy(() -> client.getDeviceListUsage(List.of(100L), Instant.EPOCH, Scale.MINUTE))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("HTTP 503");
        assertThat(requests).hasSize(3);
    }

    @Test
    void session_factory_requires_a_token() {
        EmporiaSessionFactory factory = new EmporiaSessionFactory(new VuegrafProperties(), new ObjectMapper());
        VuegrafProperties.Account account = new VuegrafProperties.Account();
        account.setName("Home");

        assertThatThrownBy(() -> factory.open(account))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("Home");
    }
}
