package com.elssolution.vuegraf.usage;

import com.elssolution.vuegraf.domain.PowerState;
import com.elssolution.vuegraf.domain.Transition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class TransitionDetectorTest {

    private static final double THRESHOLD = 1.0;

    @Test
    void first_reading_above_threshold_turns_on() {
        var d = TransitionDetector.detect(PowerState.UNKNOWN, 600, THRESHOLD);
        assertThat(d.transition()).isEqualTo(Transition.ON);
        assertThat(d.state()).isEqualTo(PowerState.ON);
    }

    @Test
    void first_reading_at_or_below_threshold_turns_off() {
        assertThat(TransitionDetector.detect(PowerState.UNKNOWN, 0.5, THRESHOLD).transition()).isEqualTo(Transition.OFF);
        assertThat(TransitionDetector.detect(PowerState.UNKNOWN, THRESHOLD, THRESHOLD).state()).isEqualTo(PowerState.OFF);
        assertThat(TransitionDetector.detect(null, 0, THRESHOLD).transition()).isEqualTo(Transition.OFF);
    }

    @Test
    void on_group_turns_off_only_below_threshold() {
        assertThat(TransitionDetector.detect(PowerState.ON, 1.0, THRESHOLD).transition()).isNull();
        assertThat(TransitionDetector.detect(PowerState.ON, 1.0, THRESHOLD).state()).isEqualTo(PowerState.ON);

        var d = TransitionDetector.detect(PowerState.ON, 0.2, THRESHOLD);
        assertThat(d.transition()).isEqualTo(Transition.OFF);
        assertThat(d.state()).isEqualTo(PowerState.OFF);
    }

    @Test
    void off_group_turns_on_only_above_threshold() {
        assertThat(TransitionDetector.detect(PowerState.OFF, 1.0, THRESHOLD).transition()).isNull();

        var d = TransitionDetector.detect(PowerState.OFF, 1.5, THRESHOLD);
        assertThat(d.transition()).isEqualTo(Transition.ON);
        assertThat(d.state()).isEqualTo(PowerState.ON);
    }

    @Test
    void transitions_alternate_for_any_reading_sequence() {
        Random rnd = new Random(42);
        for (int run = 0; run < 200; run++) {
            PowerState state = PowerState.UNKNOWN;
            List<Transition> emitted = new ArrayList<>();
            int readings = 1 + rnd.nextInt(50);
            for (int i = 0; i < readings; i++) {
                double watts = rnd.nextDouble() * 3 * THRESHOLD;
                var d = TransitionDetector.detect(state, watts, THRESHOLD);
                if (i == 0) assertThat(d.transition()).isNotNull();
                if (d.transition() != null) emitted.add(d.transition());
                state = d.state();
            }
            for (int i = 1; i < emitted.size(); i++) {
                assertThat(emitted.get(i)).isNotEqualTo(emitted.get(i - 1));
            }
        }
    }
}
