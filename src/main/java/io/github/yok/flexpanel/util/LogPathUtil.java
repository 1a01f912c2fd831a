package io.github.yok.flexpanel.util;

import com.google.common.base.Preconditions;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Generated;

/**
 * Utility for rendering file system paths in log messages.
 *
 * <p>
 * Paths under the working directory are rendered relative to it; everything else is rendered as
 * an absolute normalized path.
 * </p>
 */
public final class LogPathUtil {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private LogPathUtil() {
        throw new AssertionError("No io.github.yok.flexpanel.util.LogPathUtil instances for you!");
    }

    /**
     * Renders a path for logs.
     *
     * @param path file or directory
     * @return the path relative to {@code user.dir} when it lies below it, otherwise absolute
     * @throws NullPointerException if {@code path} is {@code null}
     */
    public static String render(Path path) {
        Preconditions.checkNotNull(path, "path must not be null");

        Path base = Paths.get(System.getProperty("user.dir")).toAbsolutePath().normalize();
        Path abs = path.toAbsolutePath().normalize();
        if (abs.startsWith(base) && !abs.equals(base)) {
            return base.relativize(abs).toString();
        }
        return abs.toString();
    }
}
