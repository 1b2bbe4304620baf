package org.gridiron.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Settings read from the {@code .env} file (and the process environment) through dotenv.
 */
public final class GridironConfig {

    public static final String YAHOO_CLIENT_ID = "YAHOO_CLIENT_ID";
    public static final String YAHOO_CLIENT_SECRET = "YAHOO_CLIENT_SECRET";
    public static final String YAHOO_ACCESS_TOKEN = "YAHOO_ACCESS_TOKEN";
    public static final String YAHOO_REFRESH_TOKEN = "YAHOO_REFRESH_TOKEN";
    public static final String YAHOO_GUID = "YAHOO_GUID";
    public static final String MISTRAL_API_KEY = "MISTRAL_API_KEY";
    public static final String SLEEPER_SCORING = "SLEEPER_SCORING";
    public static final String NFL_SEASON = "NFL_SEASON";
    public static final String ENV_FILE = "GRIDIRON_ENV_FILE";

    private static final String DEFAULT_SCORING = "pts_half_ppr";

    private final Map<String, String> values;
    private final Path envFile;

    private GridironConfig(Map<String, String> values, Path envFile) {
        this.values = values;
        this.envFile = envFile;
    }

    public static GridironConfig load() {
        String file = System.getenv().getOrDefault(ENV_FILE, ".env");
        Path envFile = Path.of(file).toAbsolutePath();
        Path directory = envFile.getParent() == null ? Path.of(".") : envFile.getParent();

        Dotenv dotenv = Dotenv.configure()
                .directory(directory.toString())
                .filename(envFile.getFileName().toString())
                .ignoreIfMissing()
                .load();

        Map<String, String> values = new HashMap<>();
        for (DotenvEntry entry : dotenv.entries()) {
            values.put(entry.getKey(), entry.getValue());
        }
        return new GridironConfig(values, envFile);
    }

    public static GridironConfig fromMap(Map<String, String> values, Path envFile) {
        return new GridironConfig(new HashMap<>(values), envFile);
    }

    public String get(String key) {
        String value = values.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    public String getOrDefault(String key, String fallback) {
        String value = get(key);
        return value == null ? fallback : value;
    }

    public String require(String key) {
        String value = get(key);
        if (value == null) {
            throw new IllegalStateException(key + " is missing! Add it to " + envFile);
        }
        return value;
    }

    public Path envFile() {
        return envFile;
    }

    public String sleeperScoring() {
        return getOrDefault(SLEEPER_SCORING, DEFAULT_SCORING);
    }

    /** NFL season year; before March the previous year's season is still the relevant one. */
    public int season() {
        String configured = get(NFL_SEASON);
        if (configured != null) {
            try {
                return Integer.parseInt(configured);
            } catch (NumberFormatException e) {
                throw new IllegalStateException(NFL_SEASON + " must be a year, got '" + configured + "'", e);
            }
        }
        LocalDate today = LocalDate.now();
        return today.getMonthValue() < 3 ? today.getYear() - 1 : today.getYear();
    }
}
