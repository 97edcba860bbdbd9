package com.enterprise.sqltemplate.script;

import com.enterprise.sqltemplate.ident.Identifiers;
import com.enterprise.sqltemplate.ident.InvalidIdentifierException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads script templates from {@code <location>/<folder>/<script>.<type>.sql}.
 *
 * <p>Folder and script names usually come straight from a URL, so both must
 * pass {@link Identifiers#isSafeSegment(String)} before touching the file
 * system.</p>
 */
public class ScriptTemplateLoader {

    private final Path location;

    public ScriptTemplateLoader(Path location) {
        this.location = Objects.requireNonNull(location, "location").toAbsolutePath().normalize();
    }

    public Path location() {
        return location;
    }

    /**
     * Resolves the script file without reading it.
     *
     * @throws InvalidIdentifierException if folder or script is not a safe segment
     */
    public Path resolve(String folder, String script, ScriptType type) {
        requireSafeSegment(folder);
        requireSafeSegment(script);
        Path path = location.resolve(folder).resolve(type.fileName(script)).normalize();
        if (!path.startsWith(location)) {
            throw new InvalidIdentifierException(folder + "/" + script);
        }
        return path;
    }

    /**
     * @throws InvalidIdentifierException if folder or script is not a safe segment
     * @throws ScriptNotFoundException    if the file does not exist
     * @throws UncheckedIOException       if the file cannot be read
     */
    public String load(String folder, String script, ScriptType type) {
        Path path = resolve(folder, script, type);
        if (!Files.isRegularFile(path)) {
            throw new ScriptNotFoundException(path);
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read script " + path, e);
        }
    }

    private static void requireSafeSegment(String segment) {
        if (!Identifiers.isSafeSegment(segment)) {
            throw new InvalidIdentifierException(segment);
        }
    }
}
