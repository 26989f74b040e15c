package org.pragmatica.stubs.parser;

import org.pragmatica.stubs.tree.VersionTuple;

/**
 * Parser configuration options.
 *
 * @param targetVersion runtime version that {@code sys.version_info} style guards compare against
 * @param platform      platform name that {@code sys.platform} style guards compare against
 */
public record ParserConfig(
    VersionTuple targetVersion,
    String platform
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        VersionTuple.of(3, 6),
        "linux"
    );

    public ParserConfig {
        if (targetVersion == null) {
            throw new IllegalArgumentException("Target version is required");
        }
        if (platform == null || platform.isBlank()) {
            throw new IllegalArgumentException("Platform is required");
        }
    }

    public static ParserConfig forVersion(VersionTuple targetVersion) {
        return new ParserConfig(targetVersion, DEFAULT.platform());
    }

    public ParserConfig withTargetVersion(VersionTuple version) {
        return new ParserConfig(version, platform);
    }

    public ParserConfig withPlatform(String name) {
        return new ParserConfig(targetVersion, name);
    }
}
