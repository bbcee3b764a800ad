package com.elssolution.vuegraf.integration.emporia;

import com.elssolution.vuegraf.domain.Channel;
import com.elssolution.vuegraf.domain.Device;
import com.elssolution.vuegraf.domain.UsageSeries;
import com.elssolution.vuegraf.integration.http.UpstreamException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmporiaJsonTest {

    private final EmporiaJson json = new EmporiaJson(new ObjectMapper());

    @Test
    void devices_are_flattened_with_nested_ones_after_their_parent() throws Exception {
        String body = """
                {"devices":[
                  {"deviceGid":100,
                   "locationProperties":{"deviceName":"Panel"},
                   "channels":[{"deviceGid":100,"channelNum":"1,2,3","name":null},
                               {"deviceGid":100,"channelNum":"1","name":"Furnace"}],
                   "devices":[{"deviceGid":200,"channels":[{"channelNum":"1,2,3"}]}]},
                  {"deviceGid":300,"channels":[]}
                ]}
                """;

        List<Device> devices = json.parseDevices(body);

        assertThat(devices).extracting(Device::gid).containsExactly(100L, 200L, 300L);
        assertThat(devices.get(0).name()).isEqualTo("Panel");
        assertThat(devices.get(0).channels()).extracting(Channel::name).containsExactly(null, "Furnace");
        assertThat(devices.get(1).channels()).singleElement()
                .satisfies(c -> assertThat(c.deviceGid()).isEqualTo(200L));
    }

    @Test
    void device_list_usage_keeps_the_nested_tree() throws Exception {
        String body = """
                {"deviceListUsages":{"instant":"2024-03-10T12:00:00Z","devices":[
                  {"deviceGid":100,"channelUsages":[
                    {"deviceGid":100,"channelNum":"1,2,3","name":"Main","usage":0.01},
                    {"deviceGid":100,"channelNum":"4","usage":null,
                     "nestedDevices":[{"deviceGid":200,"channelUsages":[
                        {"deviceGid":200,"channelNum":"1,2,3","usage":"0.002"}]}]}
                  ]}
                ]}}
                """;

        Map<Long, Device> usages = json.parseDeviceListUsage(body);

        Device panel = usages.get(100L);
        assertThat(panel.channels().get(0).usage()).isEqualTo(0.01);
        Channel four = panel.channels().get(1);
        assertThat(four.usage()).isNull();
        assertThat(four.nestedDevices()).singleElement().satisfies(nested -> {
            assertThat(nested.gid()).isEqualTo(200L);
            assertThat(nested.channels().get(0).usage()).isEqualTo(0.002);
        });
    }

    @Test
    void chart_usage_keeps_gaps_as_nulls() throws Exception {
        String body = """
                {"firstUsageInstant":"2024-03-10T11:00:00Z","usageList":[0.01,null,0.02]}
                """;

        UsageSeries series = json.parseChartUsage(body);

        assertThat(series.samples()).containsExactly(0.01, null, 0.02);
    }

    @Test
    void chart_usage_without_samples_is_empty() throws Exception {
        assertThat(json.parseChartUsage("{\"usageList\":[]}").samples()).isEmpty();
        assertThat(json.parseChartUsage("{}").samples()).isEmpty();
    }

    @Test
    void non_json_body_is_an_upstream_error() {
        assertThatThrownBy(() -> json.parseDevices("<html>gateway</html>"))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("not JSON");
    }
}
