package io.smsclient.transport.spi;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageSlotTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final MessageSlot slot = new MessageSlot();

    @Test
    void secondPutWaitsUntilFirstIsTaken() throws Exception {
        assertThat(slot.put("first")).isTrue();

        CompletableFuture<Boolean> second = CompletableFuture.supplyAsync(() -> put("second"));

        assertThat(second).isNotDone();
        Thread.sleep(200);
        assertThat(second).isNotDone();

        assertThat(slot.take(WAIT)).isEqualTo("first");
        assertThat(second.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(slot.take(WAIT)).isEqualTo("second");
    }

    @Test
    void takeTimesOutWhenEmpty() throws Exception {
        assertThat(slot.take(Duration.ofMillis(50))).isNull();
    }

    @Test
    void gracefulCloseDeliversWaitingMessageFirst() throws Exception {
        slot.put("last words");
        slot.close(new ChannelClosedException(1001, "going away"), false);

        assertThat(slot.take(WAIT)).isEqualTo("last words");
        assertThatThrownBy(() -> slot.take(WAIT))
                .isInstanceOfSatisfying(ChannelClosedException.class, e -> assertThat(e.closeCode()).isEqualTo(1001));
        assertThatThrownBy(() -> slot.take(WAIT)).isInstanceOf(ChannelClosedException.class);
    }

    @Test
    void abortDiscardsWaitingMessageAndReleasesBlockedPut() throws Exception {
        slot.put("first");
        CompletableFuture<Boolean> blocked = CompletableFuture.supplyAsync(() -> put("second"));

        slot.close(new ChannelClosedException(ChannelClosedException.NO_STATUS, "aborted"), true);

        assertThat(blocked.get(5, TimeUnit.SECONDS)).isFalse();
        assertThatThrownBy(() -> slot.take(WAIT)).isInstanceOf(ChannelClosedException.class);
    }

    @Test
    void closeWakesWaitingReader() throws Exception {
        CompletableFuture<Void> closer = CompletableFuture.runAsync(() -> {
            sleep(100);
            slot.close(new ChannelClosedException(1000, "bye"), false);
        });

        assertThatThrownBy(() -> slot.take(WAIT)).isInstanceOf(ChannelClosedException.class);
        closer.get(5, TimeUnit.SECONDS);
    }

    @Test
    void firstCloseWins() {
        slot.close(new ChannelClosedException(1001, "going away"), false);
        slot.close(new ChannelClosedException(ChannelClosedException.NO_STATUS, "aborted"), true);

        assertThatThrownBy(() -> slot.take(WAIT))
                .isInstanceOfSatisfying(ChannelClosedException.class, e -> assertThat(e.closeCode()).isEqualTo(1001));
    }

    private boolean put(String text) {
        try {
            return slot.put(text);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
