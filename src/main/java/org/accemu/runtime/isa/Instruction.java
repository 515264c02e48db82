package org.accemu.runtime.isa;

import org.accemu.runtime.Config;
import org.accemu.runtime.model.ProcessorState;

import java.util.Objects;
import java.util.Optional;

/**
 * A decoded instruction: one operation and its operand address.
 * <p>
 * Instructions are rebuilt from memory on every cycle and never stored. All of them
 * go through {@link #decode(InstructionData)}, which is the only place where raw
 * data becomes a typed instruction.
 *
 * @param opcode The operation to perform.
 * @param address The operand address, masked to the word width.
 */
public record Instruction(Opcode opcode, int address) {

    /**
     * Creates an instruction and masks its operand address.
     * @param opcode The operation to perform.
     * @param address The operand address.
     */
    public Instruction {
        Objects.requireNonNull(opcode, "opcode");
        address &= Config.ARCH_BITMASK;
    }

    /**
     * Decodes a fetched pair into an instruction.
     * @param data The raw opcode and operand cells.
     * @return The instruction, or empty if the opcode is unknown.
     */
    public static Optional<Instruction> decode(InstructionData data) {
        return Opcode.fromCode(data.opcode()).map(op -> new Instruction(op, data.address()));
    }

    /**
     * Applies this instruction to the processor state.
     * <p>
     * Jumps write the program counter directly; every other operation advances it by
     * {@link Config#INSTRUCTION_SIZE}. Afterwards the accumulator and program counter
     * are truncated to the word width.
     *
     * @param state The state to mutate.
     */
    public void execute(ProcessorState state) {
        boolean jumped = false;
        switch (opcode) {
            case ADD -> state.setAcc(state.getAcc() + state.read(address));
            case AND -> state.setAcc(state.getAcc() & state.read(address));
            case ORR -> state.setAcc(state.getAcc() | state.read(address));
            case XOR -> state.setAcc(state.getAcc() ^ state.read(address));
            case LDR -> state.setAcc(state.read(address));
            case STR -> state.write(address, state.getAcc());
            case JMP -> {
                state.setPc(address);
                jumped = true;
            }
            case JNE -> {
                if (state.getAcc() != 0) {
                    state.setPc(address);
                    jumped = true;
                }
            }
        }

        if (!jumped) {
            state.setPc(state.getPc() + Config.INSTRUCTION_SIZE);
        }
        state.mask();
    }

    /**
     * Gets the mnemonic of this instruction.
     * @return The three-letter name.
     */
    public String name() {
        return opcode.getMnemonic();
    }

    @Override
    public String toString() {
        return opcode.describe(address);
    }
}
