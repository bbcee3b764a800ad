package com.elssolution.vuegraf.usage;

import com.elssolution.vuegraf.account.AccountContext;
import com.elssolution.vuegraf.account.ChannelNameResolver;
import com.elssolution.vuegraf.config.VuegrafProperties;
import com.elssolution.vuegraf.domain.Channel;
import com.elssolution.vuegraf.domain.Device;
import com.elssolution.vuegraf.domain.PowerState;
import com.elssolution.vuegraf.domain.Scale;
import com.elssolution.vuegraf.domain.Transition;
import com.elssolution.vuegraf.domain.UsagePoint;
import com.elssolution.vuegraf.domain.UsageSeries;
import com.elssolution.vuegraf.integration.emporia.VueSession;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Turns a device usage tree into points at the resolutions an {@link ExtractionPlan} asks for.
 *
 * Realtime: one point per channel at the stop time, kWh per minute → W.
 * Detailed: per-second series, no transitions, flagged {@code detailed}.
 * History: per-minute series over the backfill window, transitions chained through the group state.
 * Null samples are gaps and produce no point. {@link Channel#COARSE_ONLY} channels get the realtime
 * point only, without a transition.
 */
@Component
public class UsageExtractor {

    private final ChannelNameResolver names;
    private final VuegrafProperties props;

    public UsageExtractor(ChannelNameResolver names, VuegrafProperties props) {
        this.names = names;
        this.props = props;
    }

    /**
     * Appends the device's points to {@code out}.
     *
     * @return the device group's power state after the pass
     */
    public PowerState extract(AccountContext account, VueSession session, Device device, PowerState previous,
                              ExtractionPlan plan, List<UsagePoint> out) throws IOException {
        return HierarchyWalker.walk(device, previous, account.getPowerStates(),
                (chan, state) -> extractChannel(account, session, chan, state, plan, out));
    }

    private PowerState extractChannel(AccountContext account, VueSession session, Channel chan, PowerState state,
                                      ExtractionPlan plan, List<UsagePoint> out) throws IOException {
        String chanName = names.channelName(account, chan);

        if (plan.realtime() && chan.usage() != null) {
            double watts = Scale.MINUTE.toWatts(chan.usage());
            Transition transition = null;
            if (!chan.isCoarseOnly()) {
                TransitionDetector.Detection d = TransitionDetector.detect(state, watts, props.getPowerOnThreshold());
                transition = d.transition();
                state = d.state();
            }
            out.add(UsagePoint.of(account.name(), chanName, watts, plan.stopTime(), false, transition));
        }

        if (chan.isCoarseOnly()) {
            return state;
        }

        if (plan.detailedStart() != null) {
            UsageSeries series = session.getChartUsage(chan, plan.detailedStart(), plan.stopTime(), Scale.SECOND);
            appendSeries(account, chanName, series, plan.detailedStart(), Scale.SECOND, out);
        }

        HistoryWindow history = plan.history();
        if (history != null) {
            UsageSeries series = session.getChartUsage(chan, history.start(), history.end(), Scale.MINUTE);
            state = appendHistory(account, chanName, series, history.start(), state, out);
        }
        return state;
    }

    private void appendSeries(AccountContext account, String chanName, UsageSeries series, Instant start,
                              Scale scale, List<UsagePoint> out) {
        List<Double> samples = series.samples();
        for (int i = 0; i < samples.size(); i++) {
            Double kwh = samples.get(i);
            if (kwh == null) continue;
            Instant ts = start.plus(scale.step().multipliedBy(i));
            out.add(UsagePoint.of(account.name(), chanName, scale.toWatts(kwh), ts, true, null));
        }
    }

    private PowerState appendHistory(AccountContext account, String chanName, UsageSeries series, Instant start,
                                     PowerState state, List<UsagePoint> out) {
        List<Double> samples = series.samples();
        for (int i = 0; i < samples.size(); i++) {
            Double kwh = samples.get(i);
            if (kwh == null) continue;
            Instant ts = start.plus(Scale.MINUTE.step().multipliedBy(i));
            double watts = Scale.MINUTE.toWatts(kwh);
            TransitionDetector.Detection d = TransitionDetector.detect(state, watts, props.getPowerOnThreshold());
            state = d.state();
            out.add(UsagePoint.of(account.name(), chanName, watts, ts, false, d.transition()));
        }
        return state;
    }
}
