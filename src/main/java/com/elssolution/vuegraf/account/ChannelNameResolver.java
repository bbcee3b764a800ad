package com.elssolution.vuegraf.account;

import com.elssolution.vuegraf.config.VuegrafProperties;
import com.elssolution.vuegraf.domain.Channel;
import com.elssolution.vuegraf.integration.emporia.VueSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Display names for devices and channels.
 *
 * Device: discovered name, else the gid. Channel: {@code <device>-<num>} by default, the configured
 * name for numbered channels of a configured device, the device name for the mains channel.
 * A device missing from the index triggers one rediscovery.
 */
@Slf4j
@Component
public class ChannelNameResolver {

    public String deviceName(AccountContext account, long gid) throws IOException {
        refreshIfUnknown(account, gid);
        return account.getIndex().device(gid)
                .map(d -> d.name() == null ? String.valueOf(gid) : d.name())
                .orElse(String.valueOf(gid));
    }

    public String channelName(AccountContext account, Channel chan) throws IOException {
        String deviceName = deviceName(account, chan.deviceGid());
        String name = deviceName + "-" + chan.channelNum();

        int num;
        try {
            num = Integer.parseInt(chan.channelNum());
        } catch (NumberFormatException e) {
            return Channel.MAINS.equals(chan.channelNum()) ? deviceName : name;
        }

        List<VuegrafProperties.DeviceNames> configured = account.getConfig().getDevices();
        if (configured == null) return name;
        for (VuegrafProperties.DeviceNames device : configured) {
            if (deviceName.equals(device.getName())) {
                List<String> channels = device.getChannels();
                if (channels != null && num >= 1 && channels.size() >= num) {
                    return channels.get(num - 1);
                }
                break;
            }
        }
        return name;
    }

    private void refreshIfUnknown(AccountContext account, long gid) throws IOException {
        if (account.getIndex().containsDevice(gid)) return;
        VueSession session = account.currentSession().orElse(null);
        if (session == null) return;
        log.info("Unknown device {} for account={}, rediscovering devices", gid, account.name());
        account.getIndex().rebuild(session.listDevices());
    }
}
