package ai.scholar.outline.config;

import java.util.Optional;

/**
 * {@link EnvironmentReader} backed by the process environment.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}
