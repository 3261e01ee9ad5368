package com.phillippitts.lifecycle.config;

import com.phillippitts.lifecycle.config.properties.StatusCoordinatorProperties;
import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.service.status.TransitionRules;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Validates lifecycle.status properties at startup to fail fast with actionable messages.
 */
@Component
class StatusConfigurationValidator {

    private final StatusCoordinatorProperties props;

    StatusConfigurationValidator(StatusCoordinatorProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        for (Map.Entry<String, String> entry : props.getInitialStatuses().entrySet()) {
            EntityKind kind = requireKind("lifecycle.status.initial-statuses", entry.getKey());
            if (kind.statusOf(entry.getValue()).isEmpty()) {
                throw new IllegalArgumentException("Invalid lifecycle.status.initial-statuses." + entry.getKey()
                        + ": '" + entry.getValue() + "'. Allowed: " + kind.statuses());
            }
        }
        for (Map.Entry<String, List<String>> entry : props.getTransitions().entrySet()) {
            EntityKind kind = requireKind("lifecycle.status.transitions", entry.getKey());
            for (String rule : entry.getValue()) {
                try {
                    TransitionRules.parse(kind, rule);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid lifecycle.status.transitions." + entry.getKey()
                            + " entry: " + e.getMessage(), e);
                }
            }
        }
    }

    private static EntityKind requireKind(String property, String key) {
        return EntityKind.fromKey(key).orElseThrow(() -> new IllegalArgumentException(
                "Invalid " + property + " key: '" + key + "'. Allowed: agent, task, workflow, message, "
                        + "feedback, model-session"));
    }
}
