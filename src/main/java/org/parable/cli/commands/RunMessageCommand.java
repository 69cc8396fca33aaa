package org.parable.cli.commands;

import com.typesafe.config.Config;
import org.parable.cli.CommandLineInterface;
import org.parable.runtime.VirtualMachine;
import org.parable.runtime.config.VmOptions;
import org.parable.runtime.host.RegistryOpcodeHost;
import org.parable.runtime.internal.services.SeededRandomProvider;
import org.parable.runtime.model.ExecutionOutcome;
import org.parable.runtime.model.ExecutionResult;
import org.parable.runtime.model.OpcodeCategory;
import org.parable.runtime.model.Operation;
import org.parable.runtime.store.FileByteSource;
import org.parable.runtime.store.PagedMessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Execute a message procedure from a message file and print its text"
)
public class RunMessageCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunMessageCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "Message file to read")
    private File file;

    @Option(names = {"-a", "--address"}, required = true, description = "Chunk address of the message")
    private int address;

    @Option(names = {"--verb"}, description = "Verb code used by word and synonym case blocks (default: 0)")
    private int verb = 0;

    @Option(names = {"--seed"}, description = "Random seed (default: parable.random.seed)")
    private Long seed;

    @Option(names = {"--tests-true"}, description = "Make every test opcode evaluate to true")
    private boolean testsTrue;

    @Option(names = {"--suppress-text"}, description = "Run control operations without printing text")
    private boolean suppressText;

    @Option(names = {"--metrics"}, description = "Print page cache metrics after execution")
    private boolean metrics;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        VmOptions options = VmOptions.fromConfig(config);
        long effectiveSeed = seed != null ? seed : options.randomSeed();
        PrintWriter out = spec.commandLine().getOut();

        try (FileByteSource source = new FileByteSource(file.toPath())) {
            PagedMessageStore store = new PagedMessageStore(source, options.geometry(), options.cacheCapacity());
            RegistryOpcodeHost host = new RegistryOpcodeHost(out, new SeededRandomProvider(effectiveSeed))
                .withVerbCode(() -> verb);
            if (testsTrue) {
                for (Operation operation : Operation.values()) {
                    if (isTest(operation)) {
                        host.onTest(operation, opcode -> true);
                    }
                }
            }

            VirtualMachine vm = new VirtualMachine(store, host, options);
            if (suppressText) {
                vm.setSuppressText(true);
            }
            ExecutionResult result = vm.displayMessage(address);
            out.println();
            LOG.debug("Message {} finished: {}", address, result);

            if (metrics) {
                store.getMetrics().forEach((name, value) -> out.println(name + ": " + value));
            }
            out.flush();
            if (result.outcome() != ExecutionOutcome.COMPLETED) {
                spec.commandLine().getErr().println("Message " + address + " ended with " + result.outcome());
                return 1;
            }
            return 0;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error reading message file: " + e.getMessage());
            return 1;
        }
    }

    private static boolean isTest(Operation operation) {
        return operation.code() >= OpcodeCategory.TEST.codeBase() && operation.code() < OpcodeCategory.EDIT.codeBase();
    }
}
