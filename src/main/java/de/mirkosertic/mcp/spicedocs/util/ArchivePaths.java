package de.mirkosertic.mcp.spicedocs.util;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Resolves caller-supplied paths against the mirror root without letting them escape it.
 */
public final class ArchivePaths {

    private ArchivePaths() {
    }

    /**
     * Resolve {@code requested} below {@code root}.
     * <p>
     * Absolute paths are rejected. The lexically normalized path must stay below the root, and if it exists
     * its real path (symlinks followed) must too. The returned path may not exist.
     *
     * @return the resolved path, or null if it lies outside the root or is not a valid path
     * @throws IOException if the root itself cannot be resolved
     */
    @Nullable
    public static Path resolveInside(final Path root, final String requested) throws IOException {
        try {
            if (Path.of(requested).isAbsolute()) {
                return null;
            }
        } catch (final InvalidPathException e) {
            return null;
        }
        final Path realRoot = root.toRealPath();
        return resolveInside(realRoot, realRoot, requested);
    }

    /**
     * Like {@link #resolveInside(Path, String)}, but relative paths start at {@code base} and paths starting
     * with {@code /} at {@code realRoot}.
     *
     * @param realRoot root as returned by {@link Path#toRealPath}
     * @param base     directory below {@code realRoot}
     */
    @Nullable
    public static Path resolveInside(final Path realRoot, final Path base, final String requested) throws IOException {
        final Path candidate;
        try {
            if (requested.startsWith("/")) {
                candidate = realRoot.resolve(requested.replaceFirst("^/+", "")).normalize();
            } else {
                candidate = base.resolve(requested).normalize();
            }
        } catch (final InvalidPathException e) {
            return null;
        }
        if (!candidate.startsWith(realRoot)) {
            return null;
        }
        if (!Files.exists(candidate)) {
            return candidate;
        }
        final Path real = candidate.toRealPath();
        return real.startsWith(realRoot) ? real : null;
    }
}
