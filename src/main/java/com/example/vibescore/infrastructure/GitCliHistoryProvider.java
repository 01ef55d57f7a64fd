package com.example.vibescore.infrastructure;

import com.example.vibescore.application.HistoryProvider;
import com.example.vibescore.application.RepositoryUnavailableException;
import com.example.vibescore.domain.ChangeRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Reads history by running the {@code git} executable in the configured working directory.
 */
@Component
public class GitCliHistoryProvider implements HistoryProvider {
    private static final Logger log = LogManager.getLogger(GitCliHistoryProvider.class);

    private final Path workingDirectory;
    private final String executable;
    private final long timeoutSeconds;

    public GitCliHistoryProvider(
            @Value("${vibescore.git.working-directory:.}") String workingDirectory,
            @Value("${vibescore.git.executable:git}") String executable,
            @Value("${vibescore.git.timeout-seconds:30}") long timeoutSeconds) {
        this.workingDirectory = Path.of(workingDirectory).toAbsolutePath().normalize();
        this.executable = executable;
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
    }

    @Override
    public void verifyRepository() {
        try {
            runGit("rev-parse", "--git-dir");
        } catch (IOException e) {
            throw new RepositoryUnavailableException(workingDirectory.toString(), e);
        }
    }

    @Override
    public List<String> listAuthorRecords(int maxChanges) throws IOException {
        return nonBlankLines(runGit("log", "--max-count=" + maxChanges, "--format=%aN|%aE"));
    }

    @Override
    public List<String> listChangeIds(int maxChanges) throws IOException {
        return nonBlankLines(runGit("log", "--max-count=" + maxChanges, "--format=%H"));
    }

    @Override
    public ChangeRecord loadChange(String changeId) throws IOException {
        return CommitRecordParser.parse(changeId, runGit("log", "-1", "--format=%aN|%aE|%at|%s", changeId));
    }

    @Override
    public String loadDiff(String changeId) throws IOException {
        return runGit("show", changeId, "--format=", "--unified=5", "--diff-filter=AM");
    }

    /**
     * Runs git and returns its trimmed standard output.
     *
     * @throws IOException if git cannot be started, exits non-zero or times out
     */
    protected String runGit(String... args) throws IOException {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add(executable);
        command.addAll(Arrays.asList(args));

        Process process = new ProcessBuilder(command).directory(workingDirectory.toFile()).start();
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException("git " + args[0] + " timed out after " + timeoutSeconds + "s");
            }
            String output = stdout.join();
            if (process.exitValue() != 0) {
                String error = stderr.join().trim();
                log.debug("git {} exited with {}: {}", args[0], process.exitValue(), error);
                throw new IOException(
                        error.isEmpty() ? "git command failed with exit code " + process.exitValue() : error);
            }
            return output.trim();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while waiting for git", e);
        } catch (CompletionException e) {
            if (e.getCause() instanceof UncheckedIOException) {
                throw ((UncheckedIOException) e.getCause()).getCause();
            }
            throw e;
        }
    }

    private static String readFully(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static List<String> nonBlankLines(String output) {
        List<String> lines = new ArrayList<>();
        for (String line : output.split("\\r?\\n")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return lines;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }
}
