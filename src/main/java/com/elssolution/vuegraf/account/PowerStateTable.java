package com.elssolution.vuegraf.account;

import com.elssolution.vuegraf.domain.PowerState;

import java.util.HashMap;
import java.util.Map;

/**
 * Last on/off state per device gid. Lives as long as the process; a restart starts from UNKNOWN.
 */
public class PowerStateTable {

    private final Map<Long, PowerState> states = new HashMap<>();

    public PowerState get(long gid) {
        return states.getOrDefault(gid, PowerState.UNKNOWN);
    }

    public void put(long gid, PowerState state) {
        states.put(gid, state);
    }
}
