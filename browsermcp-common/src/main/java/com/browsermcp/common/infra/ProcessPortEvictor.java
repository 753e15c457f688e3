package com.browsermcp.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Evicts the processes listening on a port: graceful {@code destroy()}, a grace window,
 * then {@code destroyForcibly()} for survivors. The current process is never targeted.
 *
 * <p>Listeners are discovered with {@code lsof} field output on Unix and
 * {@code netstat -ano} on Windows.
 */
@Slf4j
public class ProcessPortEvictor implements PortEvictor {

    private static final long CMD_TIMEOUT_MS = 5_000;

    private final long graceMs;
    private final long selfPid;

    public ProcessPortEvictor(long graceMs) {
        this(graceMs, ProcessHandle.current().pid());
    }

    ProcessPortEvictor(long graceMs, long selfPid) {
        this.graceMs = graceMs;
        this.selfPid = selfPid;
    }

    @Override
    public void evict(int port) {
        log.debug("Checking for existing processes on port {}", port);
        List<Long> pids = otherPids(listListenerPids(port));
        if (pids.isEmpty()) {
            log.debug("No foreign process found on port {}", port);
            return;
        }

        for (long pid : pids) {
            ProcessHandle.of(pid).ifPresent(ProcessHandle::destroy);
        }
        log.info("Sent TERM to process(es) on port {}: {}", port, pids);

        sleepQuietly(graceMs);

        List<Long> survivors = otherPids(listListenerPids(port));
        for (long pid : survivors) {
            Optional<ProcessHandle> handle = ProcessHandle.of(pid);
            if (handle.isPresent() && handle.get().isAlive()) {
                handle.get().destroyForcibly();
                log.warn("Force killed process {} on port {}", pid, port);
            }
        }
    }

    List<Long> otherPids(List<Long> pids) {
        List<Long> others = new ArrayList<>();
        for (Long pid : pids) {
            if (pid != null && pid != selfPid) {
                others.add(pid);
            }
        }
        if (others.size() < pids.size()) {
            log.debug("Skipping own pid {} among listeners", selfPid);
        }
        return others;
    }

    List<Long> listListenerPids(int port) {
        boolean isWindows = System.getProperty("os.name", "").toLowerCase().contains("win");
        try {
            if (isWindows) {
                CmdResult res = runCmd("netstat", "-ano", "-p", "tcp");
                return res.exitCode == 0 ? parseNetstatOutput(res.stdout, port) : List.of();
            }
            CmdResult res = runCmd("lsof", "-nP", "-iTCP:" + port, "-sTCP:LISTEN", "-Fp");
            // lsof exits 1 with empty output when nothing listens
            return res.exitCode == 0 ? parseLsofPids(res.stdout) : List.of();
        } catch (IOException e) {
            log.warn("Could not enumerate listeners on port {}: {}", port, e.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        }
    }

    static List<Long> parseLsofPids(String output) {
        Set<Long> pids = new LinkedHashSet<>();
        if (output == null) {
            return List.of();
        }
        for (String line : output.split("\\r?\\n")) {
            if (line.length() > 1 && line.charAt(0) == 'p') {
                try {
                    pids.add(Long.parseLong(line.substring(1).trim()));
                } catch (NumberFormatException ignored) {
                    // non-numeric pid field, skip
                }
            }
        }
        return new ArrayList<>(pids);
    }

    static List<Long> parseNetstatOutput(String output, int port) {
        Set<Long> pids = new LinkedHashSet<>();
        if (output == null) {
            return List.of();
        }
        String portToken = ":" + port;
        for (String rawLine : output.split("\\r?\\n")) {
            String line = rawLine.trim();
            if (!line.toLowerCase().contains("listen")) {
                continue;
            }
            String[] parts = line.split("\\s+");
            if (parts.length < 4 || !parts[1].endsWith(portToken)) {
                continue;
            }
            try {
                pids.add(Long.parseLong(parts[parts.length - 1]));
            } catch (NumberFormatException ignored) {
                // header or malformed row
            }
        }
        return new ArrayList<>(pids);
    }

    private record CmdResult(String stdout, int exitCode) {
    }

    private static CmdResult runCmd(String... argv) throws IOException, InterruptedException {
        Process process = new ProcessBuilder(argv).redirectErrorStream(true).start();
        String stdout;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            StringBuilder sb = new StringBuilder();
            String line;
            while ((line = reader.readLine()) != null) {
                sb.append(line).append('\n');
            }
            stdout = sb.toString();
        }
        if (!process.waitFor(CMD_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            return new CmdResult("", 1);
        }
        return new CmdResult(stdout, process.exitValue());
    }

    private static void sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
