package com.evg.common;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Default base directory, used when the configuration names none.
 */
public final class FsPaths {
    public static final String BASE_DIR_PROP   = "evg.baseDir";
    public static final String BASE_DIR_ENV    = "EVG_BASE_DIR";

    private FsPaths() {}

    /** {@code evg.baseDir}, then {@code EVG_BASE_DIR}, then the working directory. */
    public static Path baseDir() {
        String prop = System.getProperty(BASE_DIR_PROP);
        if (prop == null || prop.isBlank()) {
            String env = System.getenv(BASE_DIR_ENV);
            if (env != null && !env.isBlank()) prop = env;
        }
        Path base = (prop == null || prop.isBlank())
                ? Paths.get(System.getProperty("user.dir"))
                : Paths.get(prop);
        return base.toAbsolutePath().normalize();
    }
}
