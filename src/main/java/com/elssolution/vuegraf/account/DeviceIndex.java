package com.elssolution.vuegraf.account;

import com.elssolution.vuegraf.domain.Channel;
import com.elssolution.vuegraf.domain.Device;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Devices by gid, as discovered for one account.
 */
@Slf4j
public class DeviceIndex {

    private final Map<Long, Device> devices = new LinkedHashMap<>();

    /** Replaces the whole index with a fresh discovery result. */
    public void rebuild(List<Device> discovered) {
        devices.clear();
        for (Device device : discovered) {
            devices.put(device.gid(), device);
            for (Channel chan : device.channels()) {
                String name = chan.name() == null && Channel.MAINS.equals(chan.channelNum()) ? device.name() : chan.name();
                log.info("Discovered new channel: {} ({})", name, chan.channelNum());
            }
        }
    }

    public Optional<Device> device(long gid) {
        return Optional.ofNullable(devices.get(gid));
    }

    public boolean containsDevice(long gid) {
        return devices.containsKey(gid);
    }

    public List<Long> deviceGids() {
        return new ArrayList<>(devices.keySet());
    }
}
