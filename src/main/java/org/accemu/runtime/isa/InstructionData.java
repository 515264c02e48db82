package org.accemu.runtime.isa;

/**
 * The raw two-cell pair fetched from memory before decoding.
 * @param opcode The opcode cell.
 * @param address The operand cell.
 */
public record InstructionData(int opcode, int address) {

    /**
     * Checks for the all-zero pair that marks unused memory.
     * @return true if both cells are zero.
     */
    public boolean isEmpty() {
        return opcode == 0 && address == 0;
    }
}
