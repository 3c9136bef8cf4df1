package com.elssolution.seneccollector.integration.senec;

import com.elssolution.seneccollector.domain.RawStatus;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AsyncFetcherAdapterTest {

    private static final String HOST = "10.0.0.5";

    @Test
    void single_result_is_returned() throws Exception {
        RawStatus s = status("u8_0E");
        AsyncFetcherAdapter adapter = new AsyncFetcherAdapter(host -> CompletableFuture.completedFuture(List.of(s)));

        assertThat(adapter.fetch(HOST)).isSameAs(s);
    }

    @Test
    void result_completed_later_on_another_thread_is_awaited() throws Exception {
        RawStatus s = status("u8_0E");
        AsyncFetcherAdapter adapter = new AsyncFetcherAdapter(host -> CompletableFuture.supplyAsync(
                () -> List.of(s), CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS)));

        assertThat(adapter.fetch(HOST)).isSameAs(s);
    }

    @Test
    void zero_or_many_results_break_the_contract() {
        AsyncFetcherAdapter none = new AsyncFetcherAdapter(host -> CompletableFuture.completedFuture(List.of()));
        AsyncFetcherAdapter two = new AsyncFetcherAdapter(host ->
                CompletableFuture.completedFuture(List.of(status("a"), status("b"))));
        AsyncFetcherAdapter nullList = new AsyncFetcherAdapter(host -> CompletableFuture.completedFuture(null));

        assertThatThrownBy(() -> none.fetch(HOST)).isInstanceOfSatisfying(AdapterContractException.class,
                e -> assertThat(e.getResultCount()).isZero());
        assertThatThrownBy(() -> two.fetch(HOST)).isInstanceOfSatisfying(AdapterContractException.class,
                e -> assertThat(e.getResultCount()).isEqualTo(2));
        assertThatThrownBy(() -> nullList.fetch(HOST)).isInstanceOfSatisfying(AdapterContractException.class,
                e -> assertThat(e.getResultCount()).isZero());
    }

    @Test
    void missing_future_breaks_the_contract() {
        AsyncFetcherAdapter adapter = new AsyncFetcherAdapter(host -> null);

        assertThatThrownBy(() -> adapter.fetch(HOST)).isInstanceOf(AdapterContractException.class);
    }

    @Test
    void io_failure_becomes_fetch_exception_with_cause() {
        AsyncFetcherAdapter adapter = new AsyncFetcherAdapter(host ->
                CompletableFuture.failedFuture(new IOException("connection reset")));

        assertThatThrownBy(() -> adapter.fetch(HOST))
                .isInstanceOf(FetchException.class)
                .isNotInstanceOf(AdapterContractException.class)
                .hasMessageContaining(HOST)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void fetch_exception_from_the_source_is_passed_through() {
        FetchException original = new FetchException("HTTP 503 from " + HOST);
        AsyncFetcherAdapter adapter = new AsyncFetcherAdapter(host -> CompletableFuture.failedFuture(original));

        assertThatThrownBy(() -> adapter.fetch(HOST)).isSameAs(original);
    }

    @Test
    void source_that_throws_while_issuing_is_a_fetch_failure() {
        AsyncFetcherAdapter adapter = new AsyncFetcherAdapter(host -> {
            throw new IllegalArgumentException("bad uri");
        });

        assertThatThrownBy(() -> adapter.fetch(HOST))
                .isInstanceOf(FetchException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cancelled_request_is_a_fetch_failure() {
        CompletableFuture<List<RawStatus>> f = new CompletableFuture<>();
        f.cancel(true);
        AsyncFetcherAdapter adapter = new AsyncFetcherAdapter(host -> f);

        assertThatThrownBy(() -> adapter.fetch(HOST)).isInstanceOf(FetchException.class);
    }

    @Test
    void interrupted_wait_keeps_interrupt_flag_and_cancels() {
        CompletableFuture<List<RawStatus>> never = new CompletableFuture<>();
        AsyncFetcherAdapter adapter = new AsyncFetcherAdapter(host -> never);

        Thread.currentThread().interrupt();
        assertThatThrownBy(() -> adapter.fetch(HOST))
                .isInstanceOf(FetchException.class)
                .hasCauseInstanceOf(InterruptedException.class);

        assertThat(Thread.interrupted()).isTrue(); // also clears it for the next test
        assertThat(never).isCancelled();
    }

    private static RawStatus status(String state) {
        return RawStatus.of(JsonNodeFactory.instance.objectNode()
                .set("ENERGY", JsonNodeFactory.instance.objectNode().put("STAT_STATE", state)));
    }
}
