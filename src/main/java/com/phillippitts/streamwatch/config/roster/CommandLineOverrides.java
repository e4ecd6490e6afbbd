package com.phillippitts.streamwatch.config.roster;

import org.springframework.boot.ApplicationArguments;

import java.util.List;

/**
 * Values supplied on the command line that take precedence over the roster file's settings block,
 * including after every hot reload.
 *
 * <p>Recognised options: {@code --session-id}, {@code --data-center}, {@code --check-interval},
 * {@code --output-dir}, {@code --verbose}.
 */
public record CommandLineOverrides(String credential,
                                   String region,
                                   Integer checkIntervalSeconds,
                                   String outputDirectory,
                                   boolean verbose) {

    public static final CommandLineOverrides NONE = new CommandLineOverrides(null, null, null, null, false);

    public static CommandLineOverrides from(ApplicationArguments args) {
        if (args == null) {
            return NONE;
        }
        String interval = last(args, "check-interval");
        Integer seconds = null;
        if (interval != null) {
            try {
                seconds = Integer.valueOf(interval.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--check-interval must be an integer: " + interval, e);
            }
            if (seconds <= 0) {
                throw new IllegalArgumentException("--check-interval must be positive: " + interval);
            }
        }
        return new CommandLineOverrides(
                last(args, "session-id"),
                last(args, "data-center"),
                seconds,
                last(args, "output-dir"),
                args.containsOption("verbose"));
    }

    public boolean isEmpty() {
        return credential == null && region == null && checkIntervalSeconds == null && outputDirectory == null;
    }

    private static String last(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String v = values.get(values.size() - 1);
        return v == null || v.isBlank() ? null : v;
    }

    @Override
    public String toString() {
        return "CommandLineOverrides[credential=" + (credential != null ? "***" : "none")
                + ", region=" + region + ", checkIntervalSeconds=" + checkIntervalSeconds
                + ", outputDirectory=" + outputDirectory + ", verbose=" + verbose + "]";
    }
}
