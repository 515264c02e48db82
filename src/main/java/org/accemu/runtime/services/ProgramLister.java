package org.accemu.runtime.services;

import org.accemu.runtime.Config;
import org.accemu.runtime.isa.Instruction;
import org.accemu.runtime.isa.InstructionData;
import org.accemu.runtime.model.ProcessorState;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Produces a human-readable listing of memory, one row per instruction slot.
 * Rows that decode to a known instruction carry its mnemonic form; unused
 * (all-zero) slots and unknown opcodes show only the raw cells.
 */
public class ProgramLister {

    /**
     * Lists every instruction-aligned offset of the given state.
     * @param state The state whose memory is listed. It is not modified.
     * @return MEMORY_SIZE / INSTRUCTION_SIZE rows in address order.
     */
    public List<ListingLine> list(ProcessorState state) {
        List<ListingLine> lines = new ArrayList<>(Config.MAX_INSTRUCTIONS);
        for (int offset = 0; offset < Config.MEMORY_SIZE; offset += Config.INSTRUCTION_SIZE) {
            InstructionData data = new InstructionData(state.read(offset), state.read(offset + 1));
            Optional<String> mnemonic = data.isEmpty()
                ? Optional.empty()
                : Instruction.decode(data).map(Instruction::toString);
            lines.add(new ListingLine(offset, data.opcode(), data.address(), mnemonic));
        }
        return lines;
    }
}
