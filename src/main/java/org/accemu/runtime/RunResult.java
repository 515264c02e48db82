package org.accemu.runtime;

/**
 * Outcome of a call to {@link Emulator#run(int)}.
 */
public enum RunResult {
    /** All requested steps were executed. */
    COMPLETED,
    /** Execution stopped early because the program counter reached a breakpoint. */
    BREAKPOINT,
    /** Execution halted on an alignment or decode fault. */
    FAILED;

    /**
     * Checks whether the run ended without a fault.
     * @return true for {@link #COMPLETED} and {@link #BREAKPOINT}.
     */
    public boolean isSuccess() {
        return this != FAILED;
    }
}
