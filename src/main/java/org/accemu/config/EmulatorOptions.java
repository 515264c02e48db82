package org.accemu.config;

import com.typesafe.config.Config;

/**
 * Runtime options of an emulator instance.
 * <p>
 * Read from the {@code emulator} block:
 * <pre>
 * emulator {
 *   trace-execution = false   # log every executed instruction at DEBUG
 *   default-run-steps = 256   # steps taken by Emulator.run() without an explicit count
 * }
 * </pre>
 *
 * @param traceExecution Whether every executed instruction is logged.
 * @param defaultRunSteps The step count used by {@code run()} without arguments.
 */
public record EmulatorOptions(boolean traceExecution, int defaultRunSteps) {

    private static final String EMULATOR_PATH = "emulator";
    private static final String TRACE_KEY = "trace-execution";
    private static final String STEPS_KEY = "default-run-steps";

    public static final boolean DEFAULT_TRACE_EXECUTION = false;
    public static final int DEFAULT_RUN_STEPS = 256;

    /**
     * Creates options and validates them.
     * @param traceExecution Whether every executed instruction is logged.
     * @param defaultRunSteps The step count used by {@code run()}; must not be negative.
     */
    public EmulatorOptions {
        if (defaultRunSteps < 0) {
            throw new IllegalArgumentException("default-run-steps must not be negative: " + defaultRunSteps);
        }
    }

    /**
     * Returns the built-in defaults.
     * @return Options with tracing off and {@value #DEFAULT_RUN_STEPS} default steps.
     */
    public static EmulatorOptions defaults() {
        return new EmulatorOptions(DEFAULT_TRACE_EXECUTION, DEFAULT_RUN_STEPS);
    }

    /**
     * Reads options from a configuration. Missing keys fall back to the defaults.
     * @param config The application configuration (root level).
     * @return The parsed options.
     * @throws IllegalArgumentException if {@code default-run-steps} is negative.
     * @throws com.typesafe.config.ConfigException.WrongType if a value has the wrong type.
     */
    public static EmulatorOptions fromConfig(final Config config) {
        boolean trace = DEFAULT_TRACE_EXECUTION;
        int steps = DEFAULT_RUN_STEPS;

        if (config.hasPath(EMULATOR_PATH)) {
            final Config emulatorConfig = config.getConfig(EMULATOR_PATH);
            trace = emulatorConfig.hasPath(TRACE_KEY) ? emulatorConfig.getBoolean(TRACE_KEY) : DEFAULT_TRACE_EXECUTION;
            steps = emulatorConfig.hasPath(STEPS_KEY) ? emulatorConfig.getInt(STEPS_KEY) : DEFAULT_RUN_STEPS;
        }

        return new EmulatorOptions(trace, steps);
    }
}
