package org.carma.hedonic.config;

import org.carma.hedonic.mechanism.SearchPolicy;
import org.carma.hedonic.model.StarConfiguration;

import java.util.Objects;

/**
 * A loaded scenario: the validated game plus the search settings it asks for.
 */
public class ScenarioDefinition {

    private final String name;
    private final String description;
    private final StarConfiguration configuration;
    private final SearchPolicy policy;

    public ScenarioDefinition(String name, String description,
                              StarConfiguration configuration, SearchPolicy policy) {
        this.name = name != null ? name : "unnamed";
        this.description = description != null ? description : "";
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.policy = Objects.requireNonNull(policy, "Policy cannot be null");
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public StarConfiguration getConfiguration() {
        return configuration;
    }

    public SearchPolicy getPolicy() {
        return policy;
    }

    public ScenarioDefinition withPolicy(SearchPolicy newPolicy) {
        return new ScenarioDefinition(name, description, configuration, newPolicy);
    }

    @Override
    public String toString() {
        return String.format("ScenarioDefinition[name=%s, %s]", name, configuration);
    }
}
