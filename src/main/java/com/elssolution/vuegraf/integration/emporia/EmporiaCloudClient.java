package com.elssolution.vuegraf.integration.emporia;

import com.elssolution.vuegraf.domain.Channel;
import com.elssolution.vuegraf.domain.Device;
import com.elssolution.vuegraf.domain.Scale;
import com.elssolution.vuegraf.domain.UsageSeries;
import com.elssolution.vuegraf.integration.http.RetryingHttp;
import com.elssolution.vuegraf.integration.http.UpstreamException;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * HTTP session against the Emporia cloud API. Transport only; parsing lives in {@link EmporiaJson}.
 */
public class EmporiaCloudClient implements VueSession {

    private static final String PATH_DEVICES = "/customers/devices";
    private static final String PATH_APP_API = "/AppAPI";
    private static final String ENERGY_UNIT = "KilowattHours";

    private final RetryingHttp http;
    private final EmporiaJson json;
    private final String baseUri;
    private final String token;
    private final Duration requestTimeout;

    public EmporiaCloudClient(RetryingHttp http, EmporiaJson json, String baseUri, String token, Duration requestTimeout) {
        this.http = http;
        this.json = json;
        this.baseUri = baseUri;
        this.token = token;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public List<Device> listDevices() throws UpstreamException {
        List<Device> devices = json.parseDevices(get(PATH_DEVICES));
        List<Device> named = new ArrayList<>(devices.size());
        for (Device d : devices) {
            String name = json.parseDeviceName(get("/devices/" + d.gid() + "/locationProperties"));
            named.add(name == null ? d : new Device(d.gid(), name, d.channels()));
        }
        return named;
    }

    @Override
    public Map<Long, Device> getDeviceListUsage(Collection<Long> deviceGids, Instant instant, Scale scale)
            throws UpstreamException {
        String gids = deviceGids.stream().map(String::valueOf).collect(Collectors.joining("+"));
        String path = PATH_APP_API + "?apiMethod=getDeviceListUsages"
                + "&deviceGids=" + gids
                + "&instant=" + enc(iso(instant))
                + "&scale=" + scale.apiValue()
                + "&energyUnit=" + ENERGY_UNIT;
        return json.parseDeviceListUsage(get(path));
    }

    @Override
    public UsageSeries getChartUsage(Channel channel, Instant start, Instant end, Scale scale) throws UpstreamException {
        String path = PATH_APP_API + "?apiMethod=getChartUsage"
                + "&deviceGid=" + channel.deviceGid()
                + "&channel=" + enc(channel.channelNum())
                + "&start=" + enc(iso(start))
                + "&end=" + enc(iso(end))
                + "&scale=" + scale.apiValue()
                + "&energyUnit=" + ENERGY_UNIT;
        return json.parseChartUsage(get(path));
    }

    private String get(String path) throws UpstreamException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(safeJoin(baseUri, path)))
                .header("Accept", "application/json")
                .header("authtoken", token)
                .header("User-Agent", "vuegraf/1.0")
                .timeout(requestTimeout)
                .GET()
                .build();
        return http.send(req);
    }

    static String iso(Instant t) {
        return DateTimeFormatter.ISO_INSTANT.format(t.truncatedTo(ChronoUnit.SECONDS));
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String safeJoin(String base, String path) {
        if (base == null) return path;
        if (base.endsWith("/") && path.startsWith("/")) return base.substring(0, base.length() - 1) + path;
        if (!base.endsWith("/") && !path.startsWith("/")) return base + "/" + path;
        return base + path;
    }
}
