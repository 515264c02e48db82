package org.accemu.runtime.model;

import org.accemu.runtime.Config;
import org.accemu.runtime.isa.InstructionData;

import java.util.Arrays;

/**
 * Holds the register file and memory of the machine: the accumulator, the program
 * counter and a fixed-length array of words. Instructions mutate it in place.
 */
public final class ProcessorState {

    private int acc;
    private int pc;
    private final int[] memory;

    /**
     * Creates a zeroed processor state.
     */
    public ProcessorState() {
        this.memory = new int[Config.MEMORY_SIZE];
    }

    /**
     * Creates a deep copy of another state. The memory array is not shared.
     * @param other The state to copy.
     */
    public ProcessorState(ProcessorState other) {
        this.acc = other.acc;
        this.pc = other.pc;
        this.memory = Arrays.copyOf(other.memory, other.memory.length);
    }

    /**
     * Reads the opcode and operand cells at the current program counter.
     * The caller is responsible for checking alignment.
     * @return The raw instruction data at {@code pc}.
     */
    public InstructionData fetch() {
        return new InstructionData(memory[pc], memory[pc + 1]);
    }

    public int getAcc() {
        return acc;
    }

    public void setAcc(int acc) {
        this.acc = acc;
    }

    public int getPc() {
        return pc;
    }

    public void setPc(int pc) {
        this.pc = pc;
    }

    /**
     * Reads a memory cell.
     * @param address The cell index, in [0, MEMORY_SIZE).
     * @return The stored word.
     */
    public int read(int address) {
        return memory[address];
    }

    /**
     * Writes a memory cell. The value is masked to the word width.
     * @param address The cell index, in [0, MEMORY_SIZE).
     * @param value The value to store.
     */
    public void write(int address, int value) {
        memory[address] = value & Config.ARCH_BITMASK;
    }

    /**
     * Truncates the accumulator and the program counter to the word width.
     */
    public void mask() {
        acc &= Config.ARCH_BITMASK;
        pc &= Config.ARCH_BITMASK;
    }

    /**
     * Returns a copy of the memory contents in address order.
     * @return A new array of length MEMORY_SIZE.
     */
    public int[] memorySnapshot() {
        return Arrays.copyOf(memory, memory.length);
    }
}
