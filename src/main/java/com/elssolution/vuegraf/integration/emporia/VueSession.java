package com.elssolution.vuegraf.integration.emporia;

import com.elssolution.vuegraf.domain.Channel;
import com.elssolution.vuegraf.domain.Device;
import com.elssolution.vuegraf.domain.Scale;
import com.elssolution.vuegraf.domain.UsageSeries;

import java.io.IOException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * An established session with the energy-monitoring service for one account.
 */
public interface VueSession {

    /** All devices of the account, nested devices flattened into the list. */
    List<Device> listDevices() throws IOException;

    /**
     * Usage of every channel of the given devices for the interval ending at {@code instant},
     * keyed by device gid. Channel usage is kWh; nested devices carry their own channel usage.
     */
    Map<Long, Device> getDeviceListUsage(Collection<Long> deviceGids, Instant instant, Scale scale) throws IOException;

    /** kWh samples of one channel over {@code [start, end)} at the given resolution. */
    UsageSeries getChartUsage(Channel channel, Instant start, Instant end, Scale scale) throws IOException;
}
