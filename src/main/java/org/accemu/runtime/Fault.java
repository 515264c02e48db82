package org.accemu.runtime;

/**
 * The reasons a run can halt with {@link RunResult#FAILED}.
 */
public enum Fault {
    /** The program counter was odd at the start of a cycle. */
    ALIGNMENT,
    /** The opcode cell did not hold a known operation. */
    DECODE
}
