package com.williamcallahan.docarchive.service.configuration;

import com.williamcallahan.docarchive.domain.configuration.ConfigurationKey;
import com.williamcallahan.docarchive.model.ConfigurationOption;
import com.williamcallahan.docarchive.repository.ConfigurationOptionRepository;
import com.williamcallahan.docarchive.support.EnvironmentVariableSource;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves the effective value of a configuration key and records per-deployment overrides.
 *
 * <p>Precedence, highest first:</p>
 * <ol>
 *   <li>a non-empty stored override, coerced to the key's declared type;</li>
 *   <li>the environment variable {@code DOCARCHIVE_<KEY>}, returned as the raw string even for
 *       non-string keys;</li>
 *   <li>the key's compiled-in default, possibly {@code null}.</li>
 * </ol>
 *
 * <p>Nothing is cached: every read reflects the store and environment at call time.</p>
 */
@Service
public class ConfigurationOptionService {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationOptionService.class);

    public static final String ENVIRONMENT_PREFIX = "DOCARCHIVE_";

    private final ConfigurationOptionRepository configurationOptionRepository;
    private final EnvironmentVariableSource environmentVariables;

    public ConfigurationOptionService(
            ConfigurationOptionRepository configurationOptionRepository,
            EnvironmentVariableSource environmentVariables) {
        this.configurationOptionRepository =
                Objects.requireNonNull(configurationOptionRepository, "configurationOptionRepository");
        this.environmentVariables = Objects.requireNonNull(environmentVariables, "environmentVariables");
    }

    /**
     * Resolves a key given by name.
     *
     * @param keyName registry key name
     * @return effective value, or {@code null} when nothing is set and there is no default
     * @throws UnknownConfigurationKeyException when the name is not registered
     */
    @Transactional(readOnly = true)
    public Object get(String keyName) {
        return get(requireKey(keyName));
    }

    /**
     * Resolves a registered key.
     *
     * @param key registry key
     * @return effective value, or {@code null} when nothing is set and there is no default
     */
    @Transactional(readOnly = true)
    public Object get(ConfigurationKey key) {
        Objects.requireNonNull(key, "key");

        Optional<String> storedValue = configurationOptionRepository.findByKey(key.name())
                .map(ConfigurationOption::getValue)
                .filter(value -> !value.isEmpty());
        if (storedValue.isPresent()) {
            try {
                return key.type().coerce(storedValue.get());
            } catch (IllegalArgumentException unreadableOverride) {
                log.warn("Ignoring stored override for {}: cannot read it as {}", key.name(), key.type());
            }
        }

        String environmentValue = environmentVariables.get(environmentVariableName(key));
        if (environmentValue != null) {
            return environmentValue;
        }
        return key.defaultValue();
    }

    /**
     * Stores an override for a key given by name, replacing any previous override.
     *
     * @param keyName registry key name
     * @param value new value; its runtime class must be exactly the declared type
     * @throws UnknownConfigurationKeyException when the name is not registered
     * @throws ConfigurationTypeMismatchException when the value has the wrong type
     */
    @Transactional
    public void set(String keyName, Object value) {
        set(requireKey(keyName), value);
    }

    /**
     * Stores an override for a registered key, replacing any previous override.
     *
     * @param key registry key
     * @param value new value; its runtime class must be exactly the declared type
     * @throws ConfigurationTypeMismatchException when the value has the wrong type
     */
    @Transactional
    public void set(ConfigurationKey key, Object value) {
        Objects.requireNonNull(key, "key");
        if (!key.type().isExactInstance(value)) {
            throw new ConfigurationTypeMismatchException(key, value);
        }

        String encodedValue = key.type().encode(value);
        ConfigurationOption option = configurationOptionRepository.findByKey(key.name())
                .orElseGet(() -> new ConfigurationOption(key.name(), null));
        option.setValue(encodedValue);
        configurationOptionRepository.save(option);
        log.info("Stored configuration override for {}", key.name());
    }

    /**
     * Name of the environment variable consulted for a key.
     */
    public static String environmentVariableName(ConfigurationKey key) {
        return ENVIRONMENT_PREFIX + key.name();
    }

    private static ConfigurationKey requireKey(String keyName) {
        return ConfigurationKey.fromName(keyName)
                .orElseThrow(() -> new UnknownConfigurationKeyException(keyName));
    }
}
