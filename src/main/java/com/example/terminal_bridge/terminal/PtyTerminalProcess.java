package com.example.terminal_bridge.terminal;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Shell attached to a native pseudo-terminal through pty4j.
 */
@Slf4j
public class PtyTerminalProcess extends AbstractTerminalProcess {

    private final PtyProcess ptyProcess;
    private final OutputStream stdin;

    private PtyTerminalProcess(PtyProcess ptyProcess) {
        super(ptyProcess, "pty");
        this.ptyProcess = ptyProcess;
        this.stdin = ptyProcess.getOutputStream();
    }

    public static PtyTerminalProcess spawn(TerminalSpawnSpec spec) throws IOException {
        Validate.notEmpty(spec.getCommand(), "command must not be empty");
        Validate.isTrue(spec.getCols() > 0, "cols must be positive");
        Validate.isTrue(spec.getRows() > 0, "rows must be positive");

        Map<String, String> env = new HashMap<>(System.getenv());
        if (spec.getEnvironment() != null) {
            env.putAll(spec.getEnvironment());
        }
        env.putIfAbsent("TERM", "xterm-256color");

        PtyProcessBuilder builder = new PtyProcessBuilder(spec.getCommand().toArray(new String[0]))
                .setEnvironment(env)
                .setInitialColumns(spec.getCols())
                .setInitialRows(spec.getRows())
                .setConsole(false);
        if (spec.getWorkingDirectory() != null) {
            builder.setDirectory(spec.getWorkingDirectory());
        }

        PtyProcess process = builder.start();
        log.debug("PTY shell started: pid={}, command={}", process.pid(), spec.getCommand());
        return new PtyTerminalProcess(process);
    }

    @Override
    protected void startReaders() {
        pump(ptyProcess.getInputStream(), "out", UnaryOperator.identity());
    }

    @Override
    public synchronized void write(String data) throws IOException {
        stdin.write(data.getBytes(StandardCharsets.UTF_8));
        stdin.flush();
    }

    @Override
    public void resize(int cols, int rows) {
        Validate.isTrue(cols > 0, "cols must be positive");
        Validate.isTrue(rows > 0, "rows must be positive");
        ptyProcess.setWinSize(new WinSize(cols, rows));
    }
}
