package com.elssolution.vuegraf.integration.influx;

import com.elssolution.vuegraf.alerts.AlertService;
import com.elssolution.vuegraf.config.InfluxProperties;
import com.elssolution.vuegraf.domain.UsagePoint;
import com.elssolution.vuegraf.integration.http.UpstreamException;
import com.elssolution.vuegraf.integration.http.UpstreamTimeoutException;
import com.influxdb.client.InfluxDBClient;
import com.influxdb.client.InfluxDBClientFactory;
import com.influxdb.client.InfluxDBClientOptions;
import com.influxdb.client.domain.InfluxQLQuery;
import com.influxdb.client.domain.WritePrecision;
import com.influxdb.client.write.Point;
import com.influxdb.exceptions.InfluxException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.InterruptedIOException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Writes points to InfluxDB through the official client. Version 2 talks to an org and bucket
 * with a token; version 1 goes through the 1.8 compatibility API ({@code database/} as bucket,
 * {@code user:pass} as token).
 */
@Slf4j
@Component
public class InfluxUsageSink implements UsageSink {

    static final String EPOCH = "1970-01-01T00:00:00Z";

    private final InfluxProperties props;
    private final AlertService alerts;
    private InfluxDBClient client;

    public InfluxUsageSink(InfluxProperties props, AlertService alerts) {
        this.props = props;
        this.alerts = alerts;
    }

    @PostConstruct
    void init() {
        if (props.getVersion() != 1 && props.getVersion() != 2) {
            log.warn("influx.version must be 1 or 2 ({}). Using 2.", props.getVersion());
            props.setVersion(2);
        }
        client = InfluxDBClientFactory.create(options());
        log.info("Using InfluxDB version {} at {} (sslVerify={})", props.getVersion(), props.getUrl(), props.isSslVerify());
    }

    @PreDestroy
    void close() {
        if (client != null) client.close();
    }

    InfluxDBClientOptions options() {
        long timeoutMs = Math.max(1000, props.getRequestTimeoutMs());
        OkHttpClient.Builder http = new OkHttpClient.Builder()
                .connectTimeout(4, TimeUnit.SECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .writeTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        if (!props.isSslVerify()) {
            X509TrustManager trustAll = trustAllManager();
            http.sslSocketFactory(trustAllContext(trustAll).getSocketFactory(), trustAll);
        }

        InfluxDBClientOptions.Builder b = InfluxDBClientOptions.builder()
                .url(props.getUrl())
                .okHttpClient(http);
        if (props.getVersion() == 2) {
            b.org(props.getOrg()).bucket(props.getBucket());
            if (notBlank(props.getToken())) {
                b.authenticateToken(props.getToken().toCharArray());
            }
        } else {
            b.org("-").bucket(props.getDatabase() + "/");
            if (notBlank(props.getUser())) {
                String pass = props.getPass() == null ? "" : props.getPass();
                b.authenticateToken((props.getUser() + ":" + pass).toCharArray());
            }
        }
        return b.build();
    }

    @Override
    public void write(List<UsagePoint> points) throws UpstreamException {
        if (points.isEmpty()) return;
        List<Point> batch = new ArrayList<>(points.size());
        for (UsagePoint p : points) {
            batch.add(toPoint(p));
        }
        try {
            client.getWriteApiBlocking().writePoints(batch);
            alerts.resolve("INFLUX_DOWN");
        } catch (InfluxException e) {
            UpstreamException failure = translate("write", e);
            alerts.raise("INFLUX_DOWN", failure.getMessage(), AlertService.Severity.ERROR);
            throw failure;
        }
    }

    @Override
    public void deleteUsageBefore(Instant stop) throws UpstreamException {
        OffsetDateTime stopAt = OffsetDateTime.ofInstant(stop.truncatedTo(ChronoUnit.SECONDS), ZoneOffset.UTC);
        log.info("Resetting database: deleting {} up to {}", UsagePoint.MEASUREMENT, stopAt);
        try {
            if (props.getVersion() == 2) {
                client.getDeleteApi().delete(OffsetDateTime.parse(EPOCH), stopAt,
                        "_measurement=\"" + UsagePoint.MEASUREMENT + "\"", props.getBucket(), props.getOrg());
            } else {
                String q = "DELETE FROM " + UsagePoint.MEASUREMENT
                        + " WHERE time < '" + DateTimeFormatter.ISO_INSTANT.format(stopAt) + "'";
                client.getInfluxQLQueryApi().query(new InfluxQLQuery(q, props.getDatabase()));
            }
        } catch (InfluxException e) {
            throw translate("delete", e);
        }
    }

    static Point toPoint(UsagePoint p) {
        Point point = Point.measurement(p.measurement())
                .addTag("account_name", tagValue(p.accountName()))
                .addTag("device_name", tagValue(p.channelName()))
                // capitalised booleans, matching existing dashboards
                .addTag("detailed", p.detailed() ? "True" : "False")
                .addField("usage", p.watts())
                .time(p.time(), WritePrecision.MS);
        if (p.transition() != null) {
            point.addField("transition", p.transition().value());
        }
        return point;
    }

    private static String tagValue(String s) {
        return s == null || s.isEmpty() ? "unknown" : s;
    }

    private static UpstreamException translate(String action, InfluxException e) {
        String message = "InfluxDB " + action + " failed: " + e.getMessage();
        if (e.getCause() instanceof InterruptedIOException) {
            return new UpstreamTimeoutException(message, e);
        }
        return new UpstreamException(message, e.status() > 0 ? e.status() : -1, e);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    private static X509TrustManager trustAllManager() {
        return new X509TrustManager() {
            @Override public void checkClientTrusted(X509Certificate[] chain, String authType) { }
            @Override public void checkServerTrusted(X509Certificate[] chain, String authType) { }
            @Override public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }
        };
    }

    private static SSLContext trustAllContext(X509TrustManager trustAll) {
        try {
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, new TrustManager[]{trustAll}, new SecureRandom());
            return ctx;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot build trust-all SSL context", e);
        }
    }
}
