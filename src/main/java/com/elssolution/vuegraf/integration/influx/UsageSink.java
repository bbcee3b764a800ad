package com.elssolution.vuegraf.integration.influx;

import com.elssolution.vuegraf.domain.UsagePoint;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Time-series store the extracted points are handed to, one batch per account per cycle.
 */
public interface UsageSink {

    void write(List<UsagePoint> points) throws IOException;

    /** Removes every stored usage point up to {@code stop}. */
    void deleteUsageBefore(Instant stop) throws IOException;
}
