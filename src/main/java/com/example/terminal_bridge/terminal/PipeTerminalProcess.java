package com.example.terminal_bridge.terminal;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.SystemUtils;
import org.apache.commons.lang3.Validate;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Degraded strategy for hosts without a usable native pty: a plain child
 * process whose stdio pipes are adapted to look like terminal traffic.
 */
@Slf4j
public class PipeTerminalProcess extends AbstractTerminalProcess {

    static final String ANSI_RED = "\u001b[31m";
    static final String ANSI_RESET = "\u001b[0m";

    private static final String CTRL_C = "\u0003";
    private static final String CTRL_D = "\u0004";
    private static final String DEL = "\u007f";

    private final OutputStream stdin;
    private volatile boolean stdinClosed = false;

    private PipeTerminalProcess(Process process) {
        super(process, "pipe");
        this.stdin = process.getOutputStream();
    }

    public static PipeTerminalProcess spawn(TerminalSpawnSpec spec) throws IOException {
        Validate.notEmpty(spec.getCommand(), "command must not be empty");

        ProcessBuilder builder = new ProcessBuilder(spec.getCommand());
        if (spec.getWorkingDirectory() != null) {
            builder.directory(new File(spec.getWorkingDirectory()));
        }
        if (spec.getEnvironment() != null) {
            builder.environment().putAll(spec.getEnvironment());
        }
        builder.environment().putIfAbsent("TERM", "dumb");

        Process process = builder.start();
        log.debug("Pipe shell started: pid={}, command={}", process.pid(), spec.getCommand());
        return new PipeTerminalProcess(process);
    }

    @Override
    protected void startReaders() {
        pump(process.getInputStream(), "out", PipeTerminalProcess::toTerminalLineEndings);
        pump(process.getErrorStream(), "err", chunk -> ANSI_RED + toTerminalLineEndings(chunk) + ANSI_RESET);
    }

    static String toTerminalLineEndings(String chunk) {
        return chunk.replace("\r\n", "\n").replace("\n", "\r\n");
    }

    static String toPipeInput(String data) {
        return data.replace("\r\n", "\n").replace('\r', '\n').replace(DEL, "\b");
    }

    @Override
    public synchronized void write(String data) throws IOException {
        if (stdinClosed) {
            throw new IOException("Stream closed");
        }
        if (CTRL_C.equals(data)) {
            interrupt();
            return;
        }
        if (CTRL_D.equals(data)) {
            stdinClosed = true;
            stdin.close();
            return;
        }
        stdin.write(toPipeInput(data).getBytes(StandardCharsets.UTF_8));
        stdin.flush();
    }

    private void interrupt() {
        if (SystemUtils.IS_OS_WINDOWS) {
            log.debug("Interrupt not supported for pipe process {}", pid());
            return;
        }
        try {
            new ProcessBuilder("kill", "-INT", String.valueOf(pid())).start();
        } catch (IOException e) {
            log.warn("⚠️ Could not interrupt pipe process {}: {}", pid(), e.getMessage());
        }
    }

    @Override
    public void resize(int cols, int rows) {
        // pipes have no window size; the new geometry only lives on the session record
        log.debug("Resize ignored for pipe process {}: {}x{}", pid(), cols, rows);
    }
}
