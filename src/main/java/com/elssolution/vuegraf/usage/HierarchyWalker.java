package com.elssolution.vuegraf.usage;

import com.elssolution.vuegraf.account.PowerStateTable;
import com.elssolution.vuegraf.domain.Channel;
import com.elssolution.vuegraf.domain.Device;
import com.elssolution.vuegraf.domain.PowerState;

import java.io.IOException;

/**
 * Depth-first walk over a device's channel tree. Channels of one device share the device's power
 * state; each nested device is walked with, and writes back, its own entry in the state table.
 */
public final class HierarchyWalker {

    private HierarchyWalker() {
    }

    @FunctionalInterface
    public interface ChannelHandler {
        /** Handles one channel and returns the group's state after it. */
        PowerState onChannel(Channel channel, PowerState state) throws IOException;
    }

    /** @return the state of {@code device} after all of its channels were handled */
    public static PowerState walk(Device device, PowerState initial, PowerStateTable nestedStates,
                                  ChannelHandler handler) throws IOException {
        PowerState state = initial == null ? PowerState.UNKNOWN : initial;
        for (Channel chan : device.channels()) {
            for (Device nested : chan.nestedDevices()) {
                nestedStates.put(nested.gid(), walk(nested, nestedStates.get(nested.gid()), nestedStates, handler));
            }
            state = handler.onChannel(chan, state);
        }
        return state;
    }
}
