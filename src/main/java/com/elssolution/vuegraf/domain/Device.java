package com.elssolution.vuegraf.domain;

import java.util.List;

/**
 * A monitoring device and the channels it meters. Owns its channels, which may own further devices.
 */
public record Device(long gid, String name, List<Channel> channels) {

    public Device {
        channels = channels == null ? List.of() : List.copyOf(channels);
    }
}
