package org.parable.runtime;

import org.parable.compiler.MessageAssembler;
import org.parable.compiler.MessageImageWriter;
import org.parable.junit.extensions.logging.ExpectLog;
import org.parable.junit.extensions.logging.LogLevel;
import org.parable.junit.extensions.logging.LogWatchExtension;
import org.parable.runtime.config.VmOptions;
import org.parable.runtime.host.RegistryOpcodeHost;
import org.parable.runtime.internal.services.SeededRandomProvider;
import org.parable.runtime.model.ExecutionOutcome;
import org.parable.runtime.model.ExecutionResult;
import org.parable.runtime.model.Operation;
import org.parable.runtime.store.PagedMessageStore;
import org.parable.runtime.store.StoreGeometry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests subroutine calls between messages and their return through EndSym.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class VirtualMachineCallTest {

    private StringBuilder output;
    private RegistryOpcodeHost host;

    @BeforeEach
    void setUp() {
        output = new StringBuilder();
        host = new RegistryOpcodeHost(output, new SeededRandomProvider(7L));
    }

    /**
     * Message k prints k, calls message k+1 and prints a dot; the last message only prints.
     */
    private static PagedMessageStore callChain(int length) {
        MessageImageWriter writer = new MessageImageWriter();
        for (int k = 1; k < length; k++) {
            writer.place(k, new MessageAssembler().text(String.valueOf(k)).call(k + 1).text(".").end().toSymbols());
        }
        writer.place(length, new MessageAssembler().text(String.valueOf(length)).end().toSymbols());
        return MessageImages.storeOf(writer);
    }

    @Test
    void callRunsTheTargetAndReturnsToTheCaller() {
        PagedMessageStore store = MessageImages.storeOf(new MessageImageWriter()
            .place(1, new MessageAssembler().text("a").call(2).text("c").end().toSymbols())
            .place(2, new MessageAssembler().text("b").end().toSymbols()));
        VirtualMachine vm = new VirtualMachine(store, host);

        ExecutionResult result = vm.displayMessage(1);

        assertThat(output).hasToString("abc");
        assertThat(result.outcome()).isEqualTo(ExecutionOutcome.COMPLETED);
        assertThat(result.finalDepth()).isZero();
    }

    @Test
    void returnResumesRightAfterTheCallOperand() {
        List<String> locations = new ArrayList<>();
        PagedMessageStore store = MessageImages.storeOf(new MessageImageWriter()
            .place(1, new MessageAssembler().call(2).action(Operation.TK_OFF).end().toSymbols())
            .place(2, new MessageAssembler().action(Operation.TICK).end().toSymbols()));
        VirtualMachine vm = new VirtualMachine(store, host);
        host.onAction(Operation.TICK, opcode ->
            locations.add("callee " + vm.getCursor().getAddress() + ":" + vm.getCursor().getPosition() + " depth " + vm.getCallDepth()));
        host.onAction(Operation.TK_OFF, opcode ->
            locations.add("caller " + vm.getCursor().getAddress() + ":" + vm.getCursor().getPosition() + " depth " + vm.getCallDepth()));

        vm.displayMessage(1);

        // The call occupies positions 2..4; the caller resumes at 5 and reads its action there.
        assertThat(locations).containsExactly("callee 2:4 depth 1", "caller 1:7 depth 0");
    }

    @Test
    void nestedCallsWithinTheLimitSucceed() {
        VirtualMachine vm = new VirtualMachine(callChain(5), host);

        vm.displayMessage(1);

        assertThat(output).hasToString("12345....");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Call stack overflow at depth 3: call to message 5 .*ignored")
    void callBeyondTheLimitIsIgnored() {
        VmOptions options = new VmOptions(StoreGeometry.DEFAULT, 8, 3, 5000, false, 1L);
        VirtualMachine vm = new VirtualMachine(callChain(5), host, options);

        ExecutionResult result = vm.displayMessage(1);

        assertThat(output).hasToString("1234....");
        assertThat(result.outcome()).isEqualTo(ExecutionOutcome.COMPLETED);
        assertThat(result.finalDepth()).isZero();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Call to invalid message address 0 ignored")
    void callToInvalidAddressContinuesInTheCaller() {
        VirtualMachine vm = new VirtualMachine(
            MessageImages.storeWith(new MessageAssembler().text("a").call(0).text("b").end().toSymbols()), host);

        ExecutionResult result = vm.displayMessage(1);

        assertThat(output).hasToString("ab");
        assertThat(result.finalDepth()).isZero();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Runaway message stopped after 3 steps.*")
    void openMessageDiscardsFramesOfAnAbortedRun() {
        VmOptions options = new VmOptions(StoreGeometry.DEFAULT, 8, 32, 3, false, 1L);
        VirtualMachine vm = new VirtualMachine(callChain(3), host, options);

        ExecutionResult aborted = vm.displayMessage(1);
        assertThat(aborted.outcome()).isEqualTo(ExecutionOutcome.RUNAWAY);
        assertThat(aborted.finalDepth()).isEqualTo(1);

        vm.openMessage(3);
        assertThat(vm.getCallDepth()).isZero();
    }
}
