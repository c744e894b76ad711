package com.phillippitts.voicestream.service.stream;

import com.phillippitts.voicestream.exception.SynthesisException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ChunkChannelTest {

    @Test
    void returnsSingleQueuedChunkAsIs() {
        ChunkChannel channel = new ChunkChannel();
        byte[] chunk = {1, 2, 3};

        channel.write(chunk);

        assertThat(channel.read()).isSameAs(chunk);
    }

    @Test
    void coalescesChunksQueuedBeforeRead() {
        ChunkChannel channel = new ChunkChannel();
        channel.write(new byte[] {1, 2});
        channel.write(new byte[] {3});
        channel.write(new byte[] {4, 5});

        assertThat(channel.read()).containsExactly(1, 2, 3, 4, 5);
        assertThat(channel.pending()).isZero();
    }

    @Test
    void coalescingStopsAtEndOfStream() {
        ChunkChannel channel = new ChunkChannel();
        channel.write(new byte[] {1});
        channel.write(new byte[] {2});
        channel.end();

        assertThat(channel.read()).containsExactly(1, 2);
        assertThat(channel.isOpen()).isFalse();
        assertThat(channel.read()).isEmpty();
    }

    @Test
    void endIsIdempotent() {
        ChunkChannel channel = new ChunkChannel();
        channel.end();
        channel.end();
        channel.end();

        assertThat(channel.pending()).isEqualTo(1);
        assertThat(channel.read()).isSameAs(ChunkChannel.END_OF_STREAM);
    }

    @Test
    void readAfterEndReturnsEmptyImmediately() {
        ChunkChannel channel = new ChunkChannel();
        channel.end();
        channel.read();

        // Would block forever if it touched the queue
        CompletableFuture<byte[]> again = CompletableFuture.supplyAsync(channel::read);

        assertThat(again).succeedsWithin(Duration.ofSeconds(1)).satisfies(b -> assertThat(b).isEmpty());
    }

    @Test
    void ignoresEmptyChunksAndWritesAfterEnd() {
        ChunkChannel channel = new ChunkChannel();

        assertThat(channel.write(new byte[0])).isFalse();
        channel.write(new byte[] {7});
        channel.end();
        assertThat(channel.write(new byte[] {8})).isFalse();

        assertThat(channel.read()).containsExactly(7);
        assertThat(channel.read()).isEmpty();
    }

    @Test
    void readBlocksUntilProducerWrites() throws Exception {
        ChunkChannel channel = new ChunkChannel();
        CompletableFuture<byte[]> pending = CompletableFuture.supplyAsync(channel::read);

        TimeUnit.MILLISECONDS.sleep(50);
        assertThat(pending).isNotDone();

        channel.write(new byte[] {42});
        assertThat(pending.get(2, TimeUnit.SECONDS)).containsExactly(42);
    }

    @Test
    void failRecordsFirstCauseAndEndsStream() {
        ChunkChannel channel = new ChunkChannel();
        RuntimeException first = new RuntimeException("first");

        channel.write(new byte[] {1});
        channel.fail(first);
        channel.fail(new RuntimeException("second"));

        assertThat(channel.failure()).isSameAs(first);
        assertThat(channel.isEnded()).isTrue();
        assertThat(channel.read()).containsExactly(1);
    }

    @Test
    void discardDropsPendingDataAndLaterWrites() {
        ChunkChannel channel = new ChunkChannel();
        channel.write(new byte[] {1});

        channel.discard();

        assertThat(channel.isOpen()).isFalse();
        assertThat(channel.write(new byte[] {2})).isFalse();
        assertThat(channel.pending()).isZero();
        assertThat(channel.read()).isEmpty();
    }

    @Test
    void outputStreamViewCopiesEachWrite() throws IOException {
        ChunkChannel channel = new ChunkChannel();
        byte[] buffer = {1, 2, 3, 4};

        try (OutputStream out = channel.asOutputStream()) {
            out.write(buffer, 1, 2);
            buffer[1] = 99;
            out.write(5);
        }

        assertThat(channel.isEnded()).as("closing the view must not end the channel").isFalse();
        channel.end();
        assertThat(channel.read()).containsExactly(2, 3, 5);
    }

    @Test
    void interruptedReadRaisesSynthesisException() {
        ChunkChannel channel = new ChunkChannel();
        CompletableFuture<Throwable> result = new CompletableFuture<>();
        Thread reader = new Thread(() -> {
            try {
                channel.read();
                result.complete(null);
            } catch (Throwable t) {
                result.complete(t);
            }
        });
        reader.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> reader.getState() == Thread.State.WAITING);

        reader.interrupt();

        assertThat(result).succeedsWithin(Duration.ofSeconds(2))
                .isInstanceOf(SynthesisException.class);
    }

    @Test
    void rejectsNullChunk() {
        ChunkChannel channel = new ChunkChannel();
        assertThatThrownBy(() -> channel.write(null)).isInstanceOf(NullPointerException.class);
    }
}
