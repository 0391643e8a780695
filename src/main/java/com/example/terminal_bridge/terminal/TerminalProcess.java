package com.example.terminal_bridge.terminal;

import java.io.IOException;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * A shell process attached to one terminal slot.
 *
 * <p>Listeners must be registered before {@link #start()}; output is delivered
 * on a single reader thread per process, in the order the process produced it.
 */
public interface TerminalProcess {

    void onData(Consumer<String> listener);

    void onExit(IntConsumer listener);

    /**
     * Begins pumping output to the registered listeners.
     */
    void start();

    void write(String data) throws IOException;

    void resize(int cols, int rows);

    void kill();

    boolean isAlive();

    long pid();
}
