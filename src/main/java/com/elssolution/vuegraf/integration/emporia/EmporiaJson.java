package com.elssolution.vuegraf.integration.emporia;

import com.elssolution.vuegraf.domain.Channel;
import com.elssolution.vuegraf.domain.Device;
import com.elssolution.vuegraf.domain.UsageSeries;
import com.elssolution.vuegraf.integration.http.UpstreamException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps Emporia API responses onto the device tree. Tolerates missing fields; a body that is not
 * JSON at all is reported as an {@link UpstreamException}.
 */
public class EmporiaJson {

    private final ObjectMapper objectMapper;

    public EmporiaJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** {@code /customers/devices}: devices with their channels, nested devices appended after their parent. */
    public List<Device> parseDevices(String body) throws UpstreamException {
        List<Device> out = new ArrayList<>();
        for (JsonNode d : read(body).path("devices")) {
            collectDevice(d, out);
        }
        return out;
    }

    private void collectDevice(JsonNode d, List<Device> out) {
        long gid = d.path("deviceGid").asLong();
        List<Channel> channels = new ArrayList<>();
        for (JsonNode c : d.path("channels")) {
            channels.add(new Channel(
                    c.path("deviceGid").asLong(gid),
                    c.path("channelNum").asText(""),
                    text(c, "name"),
                    null,
                    List.of()));
        }
        String name = text(d.path("locationProperties"), "deviceName");
        out.add(new Device(gid, name, channels));
        for (JsonNode nested : d.path("devices")) {
            collectDevice(nested, out);
        }
    }

    /** {@code /devices/{gid}/locationProperties}. */
    public String parseDeviceName(String body) throws UpstreamException {
        return text(read(body), "deviceName");
    }

    /** {@code getDeviceListUsages}: one usage tree per requested device, keyed by gid. */
    public Map<Long, Device> parseDeviceListUsage(String body) throws UpstreamException {
        Map<Long, Device> out = new LinkedHashMap<>();
        for (JsonNode d : read(body).path("deviceListUsages").path("devices")) {
            Device device = usageDevice(d);
            out.put(device.gid(), device);
        }
        return out;
    }

    private Device usageDevice(JsonNode d) {
        long gid = d.path("deviceGid").asLong();
        List<Channel> channels = new ArrayList<>();
        for (JsonNode c : d.path("channelUsages")) {
            List<Device> nested = new ArrayList<>();
            for (JsonNode n : c.path("nestedDevices")) {
                nested.add(usageDevice(n));
            }
            channels.add(new Channel(
                    c.path("deviceGid").asLong(gid),
                    c.path("channelNum").asText(""),
                    text(c, "name"),
                    nodeNum(c, "usage"),
                    nested));
        }
        return new Device(gid, null, channels);
    }

    /** {@code getChartUsage}: nullable kWh samples, one per step from the requested start. */
    public UsageSeries parseChartUsage(String body) throws UpstreamException {
        List<Double> samples = new ArrayList<>();
        for (JsonNode n : read(body).path("usageList")) {
            samples.add(n.isNumber() ? Double.valueOf(n.asDouble()) : null);
        }
        return new UsageSeries(samples);
    }

    private JsonNode read(String body) throws UpstreamException {
        try {
            return objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Emporia response is not JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String text(JsonNode obj, String field) {
        JsonNode n = obj.path(field);
        return n.isTextual() ? n.asText() : null;
    }

    /** Numeric field, accepting numbers-as-strings too; null when absent. */
    private static Double nodeNum(JsonNode obj, String field) {
        JsonNode n = obj.path(field);
        if (n.isNumber()) return n.asDouble();
        if (n.isTextual()) {
            try {
                return Double.parseDouble(n.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
