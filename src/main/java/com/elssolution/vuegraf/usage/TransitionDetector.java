package com.elssolution.vuegraf.usage;

import com.elssolution.vuegraf.domain.PowerState;
import com.elssolution.vuegraf.domain.Transition;

/**
 * On/off hysteresis over a single threshold. No debounce: one reading across the threshold flips
 * the state. The first reading of an unknown group always yields a transition.
 */
public final class TransitionDetector {

    private TransitionDetector() {
    }

    /** @param transition null when the state did not change */
    public record Detection(Transition transition, PowerState state) {
    }

    public static Detection detect(PowerState previous, double watts, double threshold) {
        if (previous == null || previous == PowerState.UNKNOWN) {
            return watts > threshold
                    ? new Detection(Transition.ON, PowerState.ON)
                    : new Detection(Transition.OFF, PowerState.OFF);
        }
        if (previous == PowerState.ON && watts < threshold) {
            return new Detection(Transition.OFF, PowerState.OFF);
        }
        if (previous == PowerState.OFF && watts > threshold) {
            return new Detection(Transition.ON, PowerState.ON);
        }
        return new Detection(null, previous);
    }
}
