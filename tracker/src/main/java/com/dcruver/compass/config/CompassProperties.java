package com.dcruver.compass.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Locations of the data files and sync settings.
 * Relative file names are resolved against {@code dataDir}.
 */
@ConfigurationProperties(prefix = "compass")
@Data
public class CompassProperties {
    private String baseDir = System.getProperty("user.home") + "/.compass";
    private String dataDir;
    private String problemsFile = "problems.json";
    private String contestsFile = "contests.json";
    private String solutionsDir = "solutions";
    private Sync sync = new Sync();

    @Data
    public static class Sync {
        /** Cache of the last-used remote and branch; defaults to {@code <baseDir>/.git_config.json}. */
        private String configFile;
        private String gitExecutable = "git";
        private String remoteName = "origin";
        private String defaultBranch = "main";
    }

    public Path dataPath() {
        String dir = dataDir == null || dataDir.isBlank() ? baseDir + "/data" : dataDir;
        return Path.of(dir).toAbsolutePath().normalize();
    }

    public Path problemsPath() {
        return dataPath().resolve(problemsFile);
    }

    public Path contestsPath() {
        return dataPath().resolve(contestsFile);
    }

    public Path solutionsPath() {
        return dataPath().resolve(solutionsDir);
    }

    public Path syncConfigPath() {
        String file = sync.configFile == null || sync.configFile.isBlank()
            ? baseDir + "/.git_config.json"
            : sync.configFile;
        return Path.of(file).toAbsolutePath().normalize();
    }
}
