package org.accemu.runtime.model;

import java.util.List;

/**
 * A detached copy of everything the emulator persists.
 * @param totalCycles The number of instructions executed so far.
 * @param acc The accumulator.
 * @param pc The program counter.
 * @param memory The memory contents, one word per cell in address order.
 * @param breakpoints The breakpoints in table order.
 */
public record EmulatorSnapshot(
    long totalCycles,
    int acc,
    int pc,
    int[] memory,
    List<Breakpoint> breakpoints
) {}
