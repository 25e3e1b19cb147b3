package fr.lapetina.llmrouter.infrastructure.pool;

import fr.lapetina.llmrouter.domain.model.GenerationRequest;
import fr.lapetina.llmrouter.domain.model.UsageStatistics;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Scriptable backend for tests. Answers {@code "echo: " + userPrompt} unless told otherwise.
 */
public final class StubModelBackend implements ModelBackend {

    private final String modelId;
    private final AtomicInteger invocations = new AtomicInteger();
    private final AtomicInteger pendingFailures = new AtomicInteger();
    private final List<CompletableFuture<?>> hangingCalls = new CopyOnWriteArrayList<>();

    private volatile String content;
    private volatile UsageStatistics usage = UsageStatistics.of(10, 5);
    private volatile Throwable failure = new IllegalStateException("Backend unavailable");
    private volatile boolean alwaysFail;
    private volatile boolean hang;
    private volatile List<String> chunks = List.of("Hello", ", ", "world");
    private volatile int failAfterChunks = -1;
    private volatile boolean closed;

    public StubModelBackend(String modelId) {
        this.modelId = modelId;
    }

    @Override
    public String modelId() {
        return modelId;
    }

    @Override
    public CompletableFuture<BackendCompletion> invoke(GenerationRequest request) {
        invocations.incrementAndGet();
        if (hang) {
            return hangingCall();
        }
        if (shouldFail()) {
            return CompletableFuture.failedFuture(failure);
        }
        String text = content != null ? content : "echo: " + request.userPrompt();
        return CompletableFuture.completedFuture(new BackendCompletion(text, usage));
    }

    @Override
    public CompletableFuture<UsageStatistics> invokeStream(GenerationRequest request, Consumer<String> onDelta) {
        invocations.incrementAndGet();
        if (hang) {
            return hangingCall();
        }
        if (failAfterChunks < 0 && shouldFail()) {
            return CompletableFuture.failedFuture(failure);
        }
        List<String> parts = chunks;
        for (int i = 0; i < parts.size(); i++) {
            if (i == failAfterChunks) {
                return CompletableFuture.failedFuture(failure);
            }
            onDelta.accept(parts.get(i));
        }
        return CompletableFuture.completedFuture(usage);
    }

    @Override
    public void close() {
        closed = true;
    }

    private boolean shouldFail() {
        return alwaysFail || pendingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
    }

    private <T> CompletableFuture<T> hangingCall() {
        CompletableFuture<T> call = new CompletableFuture<>();
        hangingCalls.add(call);
        return call;
    }

    public StubModelBackend respondWith(String content) {
        this.content = content;
        return this;
    }

    public StubModelBackend usage(UsageStatistics usage) {
        this.usage = usage;
        return this;
    }

    public StubModelBackend failWith(Throwable failure) {
        this.failure = failure;
        this.alwaysFail = true;
        return this;
    }

    public StubModelBackend failNext(int times) {
        this.pendingFailures.set(times);
        return this;
    }

    public StubModelBackend hang() {
        this.hang = true;
        return this;
    }

    public StubModelBackend streamChunks(List<String> chunks) {
        this.chunks = List.copyOf(chunks);
        return this;
    }

    public StubModelBackend failAfterChunks(int emitted) {
        this.failAfterChunks = emitted;
        return this;
    }

    public int getInvocationCount() {
        return invocations.get();
    }

    public List<CompletableFuture<?>> getHangingCalls() {
        return hangingCalls;
    }

    public boolean isClosed() {
        return closed;
    }
}
