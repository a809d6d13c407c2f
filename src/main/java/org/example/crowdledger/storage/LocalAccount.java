package org.example.crowdledger.storage;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.UUID;

/**
 * Remembers which principal the CLI acts as on this machine.
 *
 * <p>The account name is kept in a plain-text file ({@code .local/account} by default). A fresh
 * install gets a generated name of the form {@code user-xxxxxxxx}.
 *
 * <h3>Error handling</h3>
 * Read/write failures are printed to {@code System.err}; callers get an ephemeral account name or
 * {@code false} instead of an exception.
 */
public final class LocalAccount {

    /** Default file holding the current account name. */
    public static final Path DEFAULT_FILE = Paths.get(".local").resolve("account");

    private LocalAccount() {}

    /** Generates a new account name such as {@code user-1f3a9c0b}. */
    public static String generate() {
        return "user-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /** {@link #ensureCurrentAccount(Path)} on {@link #DEFAULT_FILE}. */
    public static String ensureCurrentAccount() {
        return ensureCurrentAccount(DEFAULT_FILE);
    }

    /**
     * Returns the saved account name, generating and saving one if the file is missing or blank.
     * If the file cannot be written, a generated name is returned for this process only.
     *
     * @param file account file
     * @return account name, never {@code null}
     */
    public static String ensureCurrentAccount(Path file) {
        try {
            if (Files.exists(file)) {
                try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                    String s = br.readLine();
                    if (s != null && !s.isBlank()) {
                        return s.trim();
                    }
                }
            }
            String generated = generate();
            write(file, generated);
            return generated;
        } catch (IOException e) {
            String fallback = generate();
            System.err.println(
                    "Warning: cannot persist account, using ephemeral: "
                            + fallback
                            + " (cause: "
                            + e.getMessage()
                            + ")");
            return fallback;
        }
    }

    /**
     * Saves {@code account} as the default principal.
     *
     * @param file account file
     * @param account non-blank account name
     * @return {@code true} if written
     */
    public static boolean setCurrentAccount(Path file, String account) {
        if (account == null || account.isBlank()) return false;
        try {
            write(file, account.trim());
            return true;
        } catch (IOException e) {
            System.err.println("Failed to write default account: " + e.getMessage());
            return false;
        }
    }

    private static void write(Path file, String value) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (BufferedWriter bw =
                     Files.newBufferedWriter(
                             file,
                             StandardCharsets.UTF_8,
                             StandardOpenOption.CREATE,
                             StandardOpenOption.TRUNCATE_EXISTING,
                             StandardOpenOption.WRITE)) {
            bw.write(value);
            bw.write("\n");
        }
    }
}
