package org.accemu.runtime;

import org.accemu.config.EmulatorOptions;
import org.accemu.runtime.isa.Instruction;
import org.accemu.runtime.isa.InstructionData;
import org.accemu.runtime.model.Breakpoint;
import org.accemu.runtime.model.BreakpointTable;
import org.accemu.runtime.model.EmulatorSnapshot;
import org.accemu.runtime.model.ProcessorState;
import org.accemu.runtime.services.ListingLine;
import org.accemu.runtime.services.ProgramLister;
import org.accemu.runtime.services.StateFile;
import org.accemu.runtime.services.StateFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives the fetch-decode-execute loop of the accumulator machine.
 * <p>
 * An Emulator exclusively owns one {@link ProcessorState}, one {@link BreakpointTable}
 * and a cycle counter. All mutation flows through its public operations. Failures are
 * reported through return values; none of the operations throws for a machine fault,
 * a rejected breakpoint or unreadable state.
 */
public class Emulator {

    private static final Logger LOG = LoggerFactory.getLogger(Emulator.class);

    private final EmulatorOptions options;
    private final ProgramLister lister = new ProgramLister();
    private ProcessorState state;
    private final BreakpointTable breakpoints;
    private long totalCycles;
    private Fault lastFault;

    /**
     * Creates an emulator with zeroed state and default options.
     */
    public Emulator() {
        this(EmulatorOptions.defaults());
    }

    /**
     * Creates an emulator with zeroed state.
     * @param options The runtime options.
     */
    public Emulator(EmulatorOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.state = new ProcessorState();
        this.breakpoints = new BreakpointTable();
    }

    /**
     * Creates a fully independent copy of another emulator. Memory and breakpoints are
     * duplicated, not shared.
     * @param other The emulator to copy.
     */
    public Emulator(Emulator other) {
        this.options = other.options;
        this.state = new ProcessorState(other.state);
        this.breakpoints = new BreakpointTable(other.breakpoints);
        this.totalCycles = other.totalCycles;
        this.lastFault = other.lastFault;
    }

    // --- Main emulation loop ---

    /**
     * Executes up to {@code steps} instructions.
     * <p>
     * Each cycle halts with {@link RunResult#FAILED} if the program counter is odd or the
     * fetched opcode is unknown. After an instruction executes, the cycle counter is
     * incremented and, if the new program counter sits on a breakpoint, the run stops with
     * {@link RunResult#BREAKPOINT}. A breakpoint at the starting address is not checked
     * before the first instruction.
     *
     * @param steps The maximum number of instructions to execute. Zero or less succeeds immediately.
     * @return The outcome of the run.
     */
    public RunResult run(int steps) {
        lastFault = null;

        for (; steps > 0; --steps) {
            if ((state.getPc() % Config.INSTRUCTION_SIZE) != 0) {
                return fail(Fault.ALIGNMENT, "Program counter {} is not aligned", state.getPc());
            }

            InstructionData data = state.fetch();
            Optional<Instruction> decoded = Instruction.decode(data);
            if (decoded.isEmpty()) {
                return fail(Fault.DECODE, "Unknown opcode {} at {}", data.opcode(), state.getPc());
            }

            Instruction instruction = decoded.get();
            int pcBefore = state.getPc();
            instruction.execute(state);
            ++totalCycles;

            if (options.traceExecution()) {
                LOG.debug("[{}] {}: {} -> ACC={} PC={}", totalCycles, pcBefore, instruction, state.getAcc(), state.getPc());
            }

            if (isBreakpoint()) {
                LOG.debug("Breakpoint '{}' hit at {} after {} cycles",
                    breakpoints.findByAddress(state.getPc()).map(Breakpoint::name).orElse("?"), state.getPc(), totalCycles);
                return RunResult.BREAKPOINT;
            }
        }

        return RunResult.COMPLETED;
    }

    /**
     * Executes the configured default number of steps.
     * @return The outcome of the run.
     * @see EmulatorOptions#defaultRunSteps()
     */
    public RunResult run() {
        return run(options.defaultRunSteps());
    }

    private RunResult fail(Fault fault, String message, Object... args) {
        lastFault = fault;
        LOG.debug(message, args);
        return RunResult.FAILED;
    }

    /**
     * Gets the fault that ended the most recent run.
     * @return The fault, or empty if the last run did not fail.
     */
    public Optional<Fault> getLastFault() {
        return Optional.ofNullable(lastFault);
    }

    // --- Breakpoint management ---

    /**
     * Adds a named breakpoint.
     * @param address The trap address; it is masked to the word width.
     * @param name A unique name without whitespace.
     * @return false if the table is full, or the address or name is taken or invalid.
     */
    public boolean insertBreakpoint(int address, String name) {
        return breakpoints.insert(address, name);
    }

    public Optional<Breakpoint> findBreakpoint(int address) {
        return breakpoints.findByAddress(address);
    }

    public Optional<Breakpoint> findBreakpoint(String name) {
        return breakpoints.findByName(name);
    }

    public boolean deleteBreakpoint(int address) {
        return breakpoints.deleteByAddress(address);
    }

    public boolean deleteBreakpoint(String name) {
        return breakpoints.deleteByName(name);
    }

    public int numBreakpoints() {
        return breakpoints.count();
    }

    /**
     * Returns the breakpoints in table order.
     * @return A read-only view.
     */
    public List<Breakpoint> getBreakpoints() {
        return breakpoints.asList();
    }

    // --- Inspection ---

    public long cycles() {
        return totalCycles;
    }

    public int readAcc() {
        return state.getAcc();
    }

    public int readPc() {
        return state.getPc();
    }

    /**
     * Reads a memory cell.
     * @param address The address; it is masked to the allowed range first.
     * @return The stored word.
     */
    public int readMem(int address) {
        return state.read(address & Config.ARCH_BITMASK);
    }

    public boolean isZero() {
        return state.getAcc() == 0;
    }

    /**
     * Checks whether the current program counter has a breakpoint.
     * @return true if a breakpoint traps the current address.
     */
    public boolean isBreakpoint() {
        return breakpoints.indexOf(state.getPc()) >= 0;
    }

    public EmulatorOptions getOptions() {
        return options;
    }

    // --- Direct state access for program loading ---

    /**
     * Stores a word in memory. Address and value are masked to the word width.
     * @param address The target address.
     * @param value The value to store.
     */
    public void writeMem(int address, int value) {
        state.write(address & Config.ARCH_BITMASK, value);
    }

    public void setAcc(int value) {
        state.setAcc(value & Config.ARCH_BITMASK);
    }

    public void setPc(int value) {
        state.setPc(value & Config.ARCH_BITMASK);
    }

    // --- Program listing ---

    /**
     * Lists every instruction slot of memory.
     * @return One row per instruction-aligned offset.
     */
    public List<ListingLine> listProgram() {
        return lister.list(state);
    }

    /**
     * Prints the program listing, one row per line.
     * @param out The stream to print to.
     */
    public void printProgram(PrintStream out) {
        for (ListingLine line : listProgram()) {
            out.println(line.format());
        }
    }

    // --- Persistence ---

    /**
     * Captures the persisted part of the state.
     * @return A detached snapshot.
     */
    public EmulatorSnapshot snapshot() {
        return new EmulatorSnapshot(totalCycles, state.getAcc(), state.getPc(), state.memorySnapshot(),
            List.copyOf(breakpoints.asList()));
    }

    /**
     * Replaces the whole state from a file.
     * <p>
     * The file is parsed and validated completely before anything is applied, so a failed
     * load leaves the current state untouched. On success all previous breakpoints are dropped.
     *
     * @param file The file to read.
     * @return false if the file cannot be read or is malformed.
     */
    public boolean loadState(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            apply(StateFile.read(reader));
        } catch (StateFormatException e) {
            LOG.warn("Rejected state file {}: {}", file, e.getMessage());
            return false;
        } catch (IOException e) {
            LOG.warn("Could not read state file {}: {}", file, e.getMessage());
            return false;
        }
        LOG.info("Loaded state from {} ({} cycles, {} breakpoints)", file, totalCycles, breakpoints.count());
        return true;
    }

    /**
     * Replaces the whole state from a reader. See {@link #loadState(Path)}.
     * @param source The text to read. It is not closed.
     * @return false if the input cannot be read or is malformed.
     */
    public boolean loadState(Reader source) {
        try {
            apply(StateFile.read(source));
            return true;
        } catch (StateFormatException e) {
            LOG.warn("Rejected state: {}", e.getMessage());
            return false;
        } catch (IOException e) {
            LOG.warn("Could not read state: {}", e.getMessage());
            return false;
        }
    }

    private void apply(EmulatorSnapshot snapshot) {
        ProcessorState loaded = new ProcessorState();
        loaded.setAcc(snapshot.acc());
        loaded.setPc(snapshot.pc());
        int[] memory = snapshot.memory();
        for (int offset = 0; offset < Config.MEMORY_SIZE; offset++) {
            loaded.write(offset, memory[offset]);
        }

        this.state = loaded;
        this.totalCycles = snapshot.totalCycles();
        this.lastFault = null;
        breakpoints.clear();
        for (Breakpoint bp : snapshot.breakpoints()) {
            breakpoints.insert(bp.address(), bp.name());
        }
    }

    /**
     * Writes the whole state to a file, replacing its contents.
     * @param file The file to write.
     * @return false if the file cannot be written.
     */
    public boolean saveState(Path file) {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            StateFile.write(snapshot(), writer);
        } catch (IOException e) {
            LOG.warn("Could not write state file {}: {}", file, e.getMessage());
            return false;
        }
        LOG.info("Saved state to {}", file);
        return true;
    }

    /**
     * Writes the whole state to a writer. See {@link #saveState(Path)}.
     * @param target The destination. It is flushed but not closed.
     * @return false if writing fails.
     */
    public boolean saveState(Writer target) {
        try {
            StateFile.write(snapshot(), target);
            return true;
        } catch (IOException e) {
            LOG.warn("Could not write state: {}", e.getMessage());
            return false;
        }
    }
}
