package org.parable.compiler;

import org.parable.runtime.store.ByteArraySource;
import org.parable.runtime.store.Chunk;
import org.parable.runtime.store.PagedMessageStore;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class MessageImageWriterTest {

    @Test
    void everyPageStartsWithTheSentinel() {
        byte[] image = new MessageImageWriter()
            .place(100, new MessageAssembler().text("second page").end().toSymbols())
            .toByteArray();

        assertThat(image).hasSize(1024);
        assertThat(image[0]).isEqualTo((byte) 0xE5);
        assertThat(image[1]).isEqualTo((byte) 0xE5);
        assertThat(image[512]).isEqualTo((byte) 0xE5);
        assertThat(image[513]).isEqualTo((byte) 0xE5);
    }

    @Test
    void messagesAreLaidOutChunkByChunk() {
        int[] symbols = new MessageAssembler().text("abcdefghijklmn").end().toSymbols();
        PagedMessageStore store = new PagedMessageStore(new ByteArraySource(
            new MessageImageWriter().place(84, symbols).toByteArray()));

        assertThat(store.readChunk(84)).isEqualTo(Chunk.pack(6, 0, 15, 0, 7, 14, 21, 2, 9));
        for (int i = 0; i < symbols.length; i++) {
            assertThat(store.readSymbol(84L * 8 + i)).as("symbol %d", i).isEqualTo(symbols[i]);
        }
    }

    @Test
    void appendPlacesMessagesBackToBack() {
        MessageImageWriter writer = new MessageImageWriter();

        int first = writer.append(new MessageAssembler().text("spanning four chunks of text").end().toSymbols());
        int second = writer.append(new MessageAssembler().end().toSymbols());

        assertThat(first).isEqualTo(1);
        assertThat(second).isEqualTo(5);
    }

    @Test
    void rejectsOverlapsAndInvalidAddresses() {
        MessageImageWriter writer = new MessageImageWriter()
            .place(10, new MessageAssembler().text("twelve chars").end().toSymbols());

        assertThatThrownBy(() -> writer.place(11, new int[]{0, 0}))
            .isInstanceOf(AssemblyException.class)
            .hasMessageContaining("overlaps message at 10");
        assertThatThrownBy(() -> writer.place(9, new int[]{0, 0, 1, 2, 3, 4, 5, 6, 7}))
            .isInstanceOf(AssemblyException.class);
        assertThatThrownBy(() -> writer.place(0, new int[]{0, 0}))
            .isInstanceOf(AssemblyException.class);
        writer.place(12, new int[]{0, 0});
    }

    @Test
    void writesTheImageToAFile(@TempDir Path dir) throws IOException {
        MessageImageWriter writer = new MessageImageWriter()
            .place(1, new MessageAssembler().text("saved").end().toSymbols());
        Path file = dir.resolve("messages.dat");

        writer.writeTo(file);

        assertThat(Files.readAllBytes(file)).isEqualTo(writer.toByteArray());
    }
}
