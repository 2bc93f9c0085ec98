package io.act.engine.cli;

import picocli.CommandLine;

/**
 * Reports the jar's manifest version (absent when running from classes) and the JVM it runs on.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        var pkg = Main.class.getPackage();
        String version = pkg == null ? null : pkg.getImplementationVersion();
        return new String[] {
            "act-engine " + (version == null ? "development" : version),
            "JVM ${java.version} (${java.vendor})"
        };
    }
}
