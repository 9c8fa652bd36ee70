package com.example.pipelinesync.cli;

import com.example.pipelinesync.entity.SyncMode;
import org.springframework.boot.ApplicationArguments;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Parsed one-shot options: {@code --run=<entity>|all|target-opportunities|stage-transitions},
 * {@code --mode=full|incremental}, {@code --lookback=P14D}, {@code --dry-run}.
 *
 * @param lookback incremental window override, {@code null} for each entity's watermark
 */
public record OneShotCommand(String target, SyncMode mode, Duration lookback, boolean dryRun) {

    public static final String RUN_OPTION = "run";
    public static final String ALL = "all";
    public static final String STAGE_TRANSITIONS = "stage-transitions";

    /**
     * @throws IllegalArgumentException for a missing run target or malformed option
     */
    public static OneShotCommand parse(ApplicationArguments args) {
        String target = single(args, RUN_OPTION);
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("--run=<entity>|all|target-opportunities|stage-transitions is required");
        }

        String modeValue = single(args, "mode");
        SyncMode mode;
        try {
            mode = modeValue == null ? SyncMode.INCREMENTAL : SyncMode.valueOf(modeValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("--mode must be full or incremental, got " + modeValue, e);
        }

        String lookbackValue = single(args, "lookback");
        Duration lookback;
        try {
            lookback = lookbackValue == null ? null : Duration.parse(lookbackValue.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("--lookback must be an ISO-8601 duration such as P14D, got " + lookbackValue, e);
        }
        if (lookback != null && (lookback.isNegative() || lookback.isZero())) {
            throw new IllegalArgumentException("--lookback must be positive, got " + lookbackValue);
        }

        return new OneShotCommand(target.trim(), mode, lookback, args.containsOption("dry-run"));
    }

    public static boolean isOneShot(String[] args) {
        for (String arg : args) {
            if (arg.startsWith("--" + RUN_OPTION + "=")) {
                return true;
            }
        }
        return false;
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw new IllegalArgumentException("--" + name + " given more than once");
        }
        return values.get(0);
    }
}
