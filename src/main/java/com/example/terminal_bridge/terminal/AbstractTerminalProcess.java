package com.example.terminal_bridge.terminal;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.UnaryOperator;

/**
 * Reader and exit-monitor threads shared by the pty and pipe strategies.
 */
@Slf4j
abstract class AbstractTerminalProcess implements TerminalProcess {

    private static final int READ_BUFFER_SIZE = 8192;
    private static final long READER_DRAIN_TIMEOUT_MS = 2000;

    private final List<Consumer<String>> dataListeners = new CopyOnWriteArrayList<>();
    private final List<IntConsumer> exitListeners = new CopyOnWriteArrayList<>();
    private final List<Thread> readers = new ArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean exitFired = new AtomicBoolean(false);
    private final Object dispatchLock = new Object();

    protected final Process process;
    private final String threadPrefix;

    protected AbstractTerminalProcess(Process process, String threadPrefix) {
        this.process = process;
        this.threadPrefix = threadPrefix;
    }

    @Override
    public void onData(Consumer<String> listener) {
        dataListeners.add(listener);
    }

    @Override
    public void onExit(IntConsumer listener) {
        exitListeners.add(listener);
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        startReaders();
        Thread monitor = new Thread(this::awaitExit, threadPrefix + "-exit-" + pid());
        monitor.setDaemon(true);
        monitor.start();
    }

    /**
     * Subclasses call {@link #pump} once per output stream they expose.
     */
    protected abstract void startReaders();

    protected void pump(InputStream stream, String name, UnaryOperator<String> transform) {
        Thread reader = new Thread(() -> {
            try (Reader in = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                char[] buffer = new char[READ_BUFFER_SIZE];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    if (read > 0) {
                        dispatch(transform.apply(new String(buffer, 0, read)));
                    }
                }
            } catch (IOException e) {
                // closed pty/pipe surfaces as an IOException on most platforms
                log.debug("Reader {} stopped: {}", name, e.getMessage());
            }
        }, threadPrefix + "-" + name + "-" + pid());
        reader.setDaemon(true);
        readers.add(reader);
        reader.start();
    }

    private void dispatch(String chunk) {
        synchronized (dispatchLock) {
            for (Consumer<String> listener : dataListeners) {
                try {
                    listener.accept(chunk);
                } catch (RuntimeException e) {
                    log.warn("⚠️ Output listener failed for pid {}: {}", pid(), e.getMessage());
                }
            }
        }
    }

    private void awaitExit() {
        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        // let the readers flush whatever the process wrote before exiting
        for (Thread reader : readers) {
            try {
                reader.join(READER_DRAIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        fireExit(exitCode);
    }

    private void fireExit(int exitCode) {
        if (!exitFired.compareAndSet(false, true)) {
            return;
        }
        for (IntConsumer listener : exitListeners) {
            try {
                listener.accept(exitCode);
            } catch (RuntimeException e) {
                log.warn("⚠️ Exit listener failed for pid {}: {}", pid(), e.getMessage());
            }
        }
    }

    @Override
    public void kill() {
        if (!process.isAlive()) {
            return;
        }
        process.destroy();
        try {
            if (!process.waitFor(1, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public long pid() {
        try {
            return process.pid();
        } catch (UnsupportedOperationException e) {
            return -1;
        }
    }
}
