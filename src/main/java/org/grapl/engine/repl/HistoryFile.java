package org.grapl.engine.repl;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Line history of interactive sessions, persisted between runs.
 * 
 * The default location follows the XDG base directory convention:
 * $XDG_STATE_HOME/grapl/grapl.history, falling back to
 * ~/.local/state/grapl/grapl.history. Only the most recent
 * {@link #DEFAULT_MAX_ENTRIES} lines are kept unless another limit is given.
 */
public final class HistoryFile {

    static final String HISTORY_DIR = "grapl";
    static final String HISTORY_FILE = "grapl.history";

    public static final int DEFAULT_MAX_ENTRIES = 100;

    private final Path path;
    private final int maxEntries;
    private final List<String> entries = new ArrayList<>();

    public HistoryFile(Path path) {
        this(path, DEFAULT_MAX_ENTRIES);
    }

    public HistoryFile(Path path, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("History must keep at least one entry, got: " + maxEntries);
        }
        this.path = path;
        this.maxEntries = maxEntries;
    }

    /**
     * @return History at the default location for the current user
     */
    public static HistoryFile forCurrentUser() {
        return new HistoryFile(defaultPath(System.getenv(), System.getProperty("user.home")));
    }

    static Path defaultPath(Map<String, String> env, String userHome) {
        String stateHome = env.get("XDG_STATE_HOME");
        Path stateDir = stateHome != null && !stateHome.isBlank()
                ? Path.of(stateHome)
                : Path.of(userHome, ".local", "state");
        return stateDir.resolve(HISTORY_DIR).resolve(HISTORY_FILE);
    }

    /**
     * Loads previously saved entries. A missing file is an empty history.
     */
    public void load() throws IOException {
        entries.clear();
        if (Files.exists(path)) {
            entries.addAll(Files.readAllLines(path, StandardCharsets.UTF_8));
            trim();
        }
    }

    /**
     * Records an accepted line, dropping the oldest entry once the limit is
     * reached. Blank lines and immediate repeats are skipped.
     */
    public void add(String line) {
        if (line.isBlank()) {
            return;
        }
        if (!entries.isEmpty() && entries.get(entries.size() - 1).equals(line)) {
            return;
        }
        entries.add(line);
        trim();
    }

    private void trim() {
        if (entries.size() > maxEntries) {
            entries.subList(0, entries.size() - maxEntries).clear();
        }
    }

    /**
     * Writes all entries, creating the parent directories when needed.
     */
    public void save() throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, entries, StandardCharsets.UTF_8);
    }

    public List<String> entries() {
        return Collections.unmodifiableList(entries);
    }

    public Path path() {
        return path;
    }
}
