package com.phillippitts.talkback.service.stt.whisper;

import com.phillippitts.talkback.config.stt.WhisperProperties;
import com.phillippitts.talkback.exception.TranscriptionFailureBuilder;
import com.phillippitts.talkback.exception.TranscriptionServiceUnavailableException;
import com.phillippitts.talkback.util.ProcessTimeouts;
import com.phillippitts.talkback.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external whisper.cpp binary once per WAV file.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Build a deterministic CLI from {@link WhisperProperties} and a language code</li>
 *   <li>Capture stdout (transcript) and stderr (diagnostics) concurrently</li>
 *   <li>Enforce the timeout and terminate runaway processes</li>
 * </ul>
 *
 * <p>Every call owns its own process, so one runner serves concurrent callers. Temp-file WAV
 * handling is performed by the caller.
 */
public final class WhisperProcessRunner {

    private static final Logger LOG = LogManager.getLogger(WhisperProcessRunner.class);

    /** Maximum bytes captured from stderr per run. */
    static final int STDERR_MAX_BYTES = 256 * 1024;

    /** Maximum stderr characters included in an error message. */
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    private final ProcessFactory processFactory;

    public WhisperProcessRunner() {
        this(new DefaultProcessFactory());
    }

    WhisperProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Executes whisper.cpp for the given WAV file and returns its stdout.
     *
     * <p>CLI contract:
     *   <pre>
     *   ${binary} -m ${model} -f ${wav} -l ${language} -nt -otxt -of stdout -t ${threads}
     *   </pre>
     *
     * @param wavPath  WAV file created by the caller
     * @param language whisper language code (e.g. "en", "tl")
     * @param cfg      whisper configuration
     * @return stdout produced by whisper (may be empty)
     * @throws TranscriptionServiceUnavailableException on timeout, non-zero exit, or I/O error
     */
    public String run(Path wavPath, String language, WhisperProperties cfg) {
        Objects.requireNonNull(wavPath, "wavPath");
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(cfg, "cfg");

        List<String> command = buildCommand(cfg, wavPath, language);
        long startTime = System.nanoTime();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = null;
        Thread outGobbler = null;
        Thread errGobbler = null;

        try {
            process = processFactory.start(command, wavPath.getParent());
            // Start gobblers before waiting to avoid pipe deadlock
            outGobbler = startGobbler(process.getInputStream(), stdout, "whisper-out", cfg.maxStdoutBytes());
            errGobbler = startGobbler(process.getErrorStream(), stderr, "whisper-err", STDERR_MAX_BYTES);

            boolean finished = process.waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                destroyProcess(process);
                throw failure("Timeout after " + cfg.timeoutSeconds() + "s", cfg, -1, stderr, startTime, null);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw failure("Non-zero exit: " + exitCode, cfg, exitCode, stderr, startTime, null);
            }
            LOG.debug("Whisper stdout size={} chars in {} ms", stdout.length(), TimeUtils.elapsedMillis(startTime));
            return stdout.toString();
        } catch (IOException e) {
            throw failure("I/O failure: " + e.getMessage(), cfg, -1, stderr, startTime, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("Interrupted", cfg, -1, stderr, startTime, e);
        } finally {
            if (process != null && process.isAlive()) {
                destroyProcess(process);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        }
    }

    List<String> buildCommand(WhisperProperties cfg, Path wavPath, String language) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(cfg.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(resolvePath(cfg.modelPath()).toString());
        cmd.add("-f");
        cmd.add(wavPath.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(language);
        cmd.add("-nt");
        cmd.add("-otxt");
        cmd.add("-of");
        cmd.add("stdout");
        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));
        return cmd;
    }

    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private static Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a bounded buffer. Past the cap the stream is still drained so the
     * process never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        sink.append(line, 0, Math.min(line.length(), Math.max(0, available)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        }
    }

    private static TranscriptionServiceUnavailableException failure(String msg, WhisperProperties cfg, int exitCode,
                                                                     StringBuilder stderr, long startNano,
                                                                     Throwable cause) {
        String snippet;
        synchronized (stderr) {
            snippet = stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length()));
        }
        return TranscriptionFailureBuilder.create(msg)
                .recognizer(WhisperSpeechRecognizer.NAME)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNano))
                .detail("binaryPath", cfg.binaryPath())
                .detail("modelPath", cfg.modelPath())
                .detail("stderr", snippet)
                .cause(cause)
                .build();
    }
}
