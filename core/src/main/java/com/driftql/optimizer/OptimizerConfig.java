package com.driftql.optimizer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Optimizer settings.
 *
 * <ul>
 *   <li>{@code driftql.optimizer.maxPlans} - upper limit for the number of
 *       candidate plans kept after each rule (default 192)</li>
 *   <li>{@code driftql.optimizer.disabledRules} - comma-separated names of
 *       rules to skip</li>
 *   <li>{@code driftql.optimizer.validatePlans} - run the plan validator after
 *       every rule application (default false)</li>
 * </ul>
 *
 * <p>{@link #load()} reads {@value #RESOURCE_NAME} from the classpath, if
 * present, and lets JVM system properties override it.
 */
public final class OptimizerConfig {

    public static final String RESOURCE_NAME = "driftql-optimizer.properties";

    public static final String MAX_PLANS_KEY = "driftql.optimizer.maxPlans";
    public static final String DISABLED_RULES_KEY = "driftql.optimizer.disabledRules";
    public static final String VALIDATE_PLANS_KEY = "driftql.optimizer.validatePlans";

    /** Default limit for candidate plans */
    public static final int DEFAULT_MAX_PLANS = 192;

    /** Hard limit for candidate plans */
    public static final int MAX_MAX_PLANS = 4096;

    private final int maxNumberOfPlans;
    private final Set<String> disabledRules;
    private final boolean validatePlans;

    private OptimizerConfig(int maxNumberOfPlans, Set<String> disabledRules, boolean validatePlans) {
        this.maxNumberOfPlans = normalizeMaxPlans(maxNumberOfPlans);
        this.disabledRules = Collections.unmodifiableSet(new LinkedHashSet<>(disabledRules));
        this.validatePlans = validatePlans;
    }

    public static OptimizerConfig defaults() {
        return new OptimizerConfig(DEFAULT_MAX_PLANS, Set.of(), false);
    }

    /**
     * Creates a configuration with explicit values.
     *
     * @param maxNumberOfPlans the candidate plan limit (normalized into [1, {@value #MAX_MAX_PLANS}])
     * @param disabledRules names of rules to skip
     * @param validatePlans whether to validate plans after every rule
     * @return the configuration
     */
    public static OptimizerConfig of(int maxNumberOfPlans, Set<String> disabledRules, boolean validatePlans) {
        Objects.requireNonNull(disabledRules, "disabledRules must not be null");
        return new OptimizerConfig(maxNumberOfPlans, disabledRules, validatePlans);
    }

    /**
     * Reads a configuration from properties; missing keys take their defaults.
     *
     * @param properties the properties
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static OptimizerConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        int maxPlans = parseMaxPlans(properties.getProperty(MAX_PLANS_KEY));
        Set<String> disabled = parseRuleList(properties.getProperty(DISABLED_RULES_KEY));
        boolean validate = parseBoolean(VALIDATE_PLANS_KEY, properties.getProperty(VALIDATE_PLANS_KEY));
        return new OptimizerConfig(maxPlans, disabled, validate);
    }

    /**
     * Loads the configuration from the classpath resource and system properties.
     *
     * @return the configuration
     * @throws UncheckedIOException if the resource exists but cannot be read
     */
    public static OptimizerConfig load() {
        Properties properties = new Properties();
        try (InputStream in = OptimizerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
        for (String key : new String[] {MAX_PLANS_KEY, DISABLED_RULES_KEY, VALIDATE_PLANS_KEY}) {
            String value = System.getProperty(key);
            if (value != null) {
                properties.setProperty(key, value);
            }
        }
        return fromProperties(properties);
    }

    public int maxNumberOfPlans() {
        return maxNumberOfPlans;
    }

    public Set<String> disabledRules() {
        return disabledRules;
    }

    public boolean isRuleDisabled(String ruleName) {
        return disabledRules.contains(ruleName);
    }

    public boolean validatePlans() {
        return validatePlans;
    }

    /**
     * Clamp a plan limit into the allowed bounds.
     *
     * @param requested the requested limit
     * @return the limit within [1, {@value #MAX_MAX_PLANS}]
     */
    public static int normalizeMaxPlans(int requested) {
        if (requested < 1) return 1;
        if (requested > MAX_MAX_PLANS) return MAX_MAX_PLANS;
        return requested;
    }

    private static int parseMaxPlans(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_MAX_PLANS;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Invalid value for %s: '%s'. Expected a positive integer".formatted(MAX_PLANS_KEY, value), e);
        }
    }

    private static Set<String> parseRuleList(String value) {
        Set<String> rules = new LinkedHashSet<>();
        if (value == null) {
            return rules;
        }
        for (String part : value.split(",")) {
            String name = part.trim();
            if (!name.isEmpty()) {
                rules.add(name);
            }
        }
        return rules;
    }

    private static boolean parseBoolean(String key, String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        return switch (value.trim().toLowerCase()) {
            case "true"  -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException(
                "Invalid value for %s: '%s'. Valid values: true, false".formatted(key, value));
        };
    }

    @Override
    public String toString() {
        return "OptimizerConfig(maxNumberOfPlans=" + maxNumberOfPlans
            + ", disabledRules=" + disabledRules + ", validatePlans=" + validatePlans + ")";
    }
}
