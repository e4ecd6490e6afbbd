package com.phillippitts.streamwatch.service.control;

import java.time.Duration;

/**
 * Operator instruction read from the sentinel files.
 *
 * @param type what to do
 * @param reason stop reason text (stop only)
 * @param pause how long to suspend polling (pause only)
 */
public record ControlSignal(Type type, String reason, Duration pause) {

    public enum Type { NONE, STOP, PAUSE }

    public static final ControlSignal NONE = new ControlSignal(Type.NONE, null, null);

    public static ControlSignal stop(String reason) {
        return new ControlSignal(Type.STOP, reason, null);
    }

    public static ControlSignal pause(Duration pause) {
        return new ControlSignal(Type.PAUSE, null, pause);
    }

    public boolean isStop() {
        return type == Type.STOP;
    }

    public boolean isPause() {
        return type == Type.PAUSE;
    }
}
