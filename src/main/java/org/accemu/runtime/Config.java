package org.accemu.runtime;

/**
 * Fixed architecture parameters of the accumulator machine.
 * This final class contains static constants that define the word width, the memory
 * layout and the instruction encoding. It is not meant to be instantiated.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The number of bits in a machine word.
     */
    public static final int WORD_BITS = 8;

    /**
     * A bitmask that truncates any value to the word width.
     */
    public static final int ARCH_BITMASK = (1 << WORD_BITS) - 1;

    /**
     * The largest value a word can hold.
     */
    public static final int MAX_VALUE = ARCH_BITMASK;

    /**
     * The number of addressable memory cells. Every masked address is a valid index.
     */
    public static final int MEMORY_SIZE = 1 << WORD_BITS;

    /**
     * The number of cells an instruction occupies: one opcode cell and one operand cell.
     */
    public static final int INSTRUCTION_SIZE = 2;

    /**
     * The maximum number of distinct instruction addresses, which bounds the breakpoint table.
     */
    public static final int MAX_INSTRUCTIONS = MEMORY_SIZE / INSTRUCTION_SIZE;
}
