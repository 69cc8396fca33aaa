package org.parable.cli.commands;

import org.parable.cli.CommandLineInterface;
import org.parable.runtime.config.VmOptions;
import org.parable.runtime.services.DisassembledItem;
import org.parable.runtime.services.MessageDisassembler;
import org.parable.runtime.services.SymbolDump;
import org.parable.runtime.store.FileByteSource;
import org.parable.runtime.store.PagedMessageStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "disassemble",
    description = "List the control structure or the raw symbols of a message"
)
public class DisassembleCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, required = true, description = "Message file to read")
    private File file;

    @Option(names = {"-a", "--address"}, required = true, description = "Chunk address of the message")
    private int address;

    @Option(names = {"--raw"}, description = "Dump raw symbols instead of a listing")
    private boolean raw;

    @Option(names = {"--start"}, description = "First symbol position for --raw (default: 0)")
    private int start = 0;

    @Option(names = {"--count"}, description = "Number of symbols for --raw (default: 64)")
    private int count = 64;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        VmOptions options = VmOptions.fromConfig(parent.getConfig());
        PrintWriter out = spec.commandLine().getOut();

        try (FileByteSource source = new FileByteSource(file.toPath())) {
            PagedMessageStore store = new PagedMessageStore(source, options.geometry(), options.cacheCapacity());
            MessageDisassembler disassembler = new MessageDisassembler(store);

            if (raw) {
                for (SymbolDump symbol : disassembler.dumpSymbols(address, start, count)) {
                    out.println(symbol);
                }
                out.flush();
                return 0;
            }

            List<DisassembledItem> items = disassembler.disassemble(address);
            if (items.isEmpty()) {
                spec.commandLine().getErr().println("No message at address " + address);
                return 1;
            }
            out.println("message " + address);
            items.forEach(out::println);
            out.flush();
            return 0;
        } catch (IllegalArgumentException | IOException e) {
            spec.commandLine().getErr().println("Error disassembling message: " + e.getMessage());
            return 1;
        }
    }
}
