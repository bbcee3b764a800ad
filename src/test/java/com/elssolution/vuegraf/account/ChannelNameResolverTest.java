package com.elssolution.vuegraf.account;

import com.elssolution.vuegraf.config.VuegrafProperties;
import com.elssolution.vuegraf.domain.Channel;
import com.elssolution.vuegraf.domain.Device;
import com.elssolution.vuegraf.integration.emporia.VueSession;
import com.elssolution.vuegraf.integration.emporia.VueSessionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChannelNameResolverTest {

    private final ChannelNameResolver resolver = new ChannelNameResolver();
    private VueSession session;
    private AccountContext account;

    @BeforeEach
    void setUp() throws Exception {
        VuegrafProperties.DeviceNames panel = new VuegrafProperties.DeviceNames();
        panel.setName("Panel");
        panel.setChannels(List.of("Furnace", "Dryer"));
        VuegrafProperties.Account config = new VuegrafProperties.Account();
        config.setName("Home");
        config.setDevices(List.of(panel));

        session = mock(VueSession.class);
        when(session.listDevices()).thenReturn(List.of(
                new Device(100L, "Panel", List.of(new Channel(100L, Channel.MAINS, null, null, List.of()))),
                new Device(200L, "Garage", List.of())));
        VueSessionFactory factory = mock(VueSessionFactory.class);
        when(factory.open(any())).thenReturn(session);

        account = new AccountContext(config, false);
        account.ensureSession(factory);
    }

    private static Channel chan(long gid, String num) {
        return new Channel(gid, num, null, null, List.of());
    }

    @Test
    void configured_channel_names_win() throws Exception {
        assertThat(resolver.channelName(account, chan(100L, "1"))).isEqualTo("Furnace");
        assertThat(resolver.channelName(account, chan(100L, "2"))).isEqualTo("Dryer");
    }

    @Test
    void unconfigured_channels_default_to_device_dash_number() throws Exception {
        assertThat(resolver.channelName(account, chan(100L, "3"))).isEqualTo("Panel-3");
        assertThat(resolver.channelName(account, chan(200L, "1"))).isEqualTo("Garage-1");
        assertThat(resolver.channelName(account, chan(100L, "Balance"))).isEqualTo("Panel-Balance");
    }

    @Test
    void mains_channel_takes_the_device_name() throws Exception {
        assertThat(resolver.channelName(account, chan(100L, Channel.MAINS))).isEqualTo("Panel");
        assertThat(resolver.channelName(account, new Channel(100L, Channel.MAINS, "Main", null, List.of())))
                .isEqualTo("Panel");
    }

    @Test
    void unknown_device_triggers_one_rediscovery() throws Exception {
        when(session.listDevices()).thenReturn(List.of(new Device(300L, "Shed", List.of())));

        assertThat(resolver.deviceName(account, 300L)).isEqualTo("Shed");
        assertThat(resolver.deviceName(account, 300L)).isEqualTo("Shed");

        verify(session, times(2)).listDevices();
    }

    @Test
    void device_still_unknown_after_rediscovery_is_named_by_gid() throws Exception {
        assertThat(resolver.channelName(account, chan(999L, "1"))).isEqualTo("999-1");
    }
}
