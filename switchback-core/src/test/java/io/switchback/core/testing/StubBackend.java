package io.switchback.core.testing;

import io.switchback.core.backend.Backend;
import io.switchback.core.backend.BackendException;
import io.switchback.core.backend.BackendKind;
import io.switchback.core.backend.GenerationRequest;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

public final class StubBackend implements Backend {

    @FunctionalInterface
    public interface Responder {
        Optional<String> respond(GenerationRequest request) throws BackendException;
    }

    private final String name;
    private final BackendKind kind;
    private final boolean available;
    private final Responder responder;
    private final List<GenerationRequest> requests = new CopyOnWriteArrayList<>();

    public StubBackend(String name, BackendKind kind, boolean available, Responder responder) {
        this.name = name;
        this.kind = kind;
        this.available = available;
        this.responder = responder;
    }

    public static StubBackend replying(String name, BackendKind kind, String text) {
        return new StubBackend(name, kind, true, request -> Optional.of(text));
    }

    public static StubBackend failing(String name, BackendKind kind) {
        return new StubBackend(name, kind, true, request -> {
            throw new BackendException(name, "boom");
        });
    }

    public static StubBackend empty(String name, BackendKind kind) {
        return new StubBackend(name, kind, true, request -> Optional.empty());
    }

    public static StubBackend unavailable(String name, BackendKind kind) {
        return new StubBackend(name, kind, false, request -> {
            throw new BackendException(name, "not configured");
        });
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public BackendKind kind() {
        return kind;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public Optional<String> generate(GenerationRequest request) throws BackendException {
        requests.add(request);
        return responder.respond(request);
    }

    public int calls() {
        return requests.size();
    }

    public List<GenerationRequest> requests() {
        return List.copyOf(requests);
    }
}
