package fr.lapetina.aigateway.api.dto;

import fr.lapetina.aigateway.domain.model.Priority;

import java.util.Arrays;
import java.util.Locale;

final class ApiPriorities {

    private ApiPriorities() {
    }

    static Priority parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Priority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown priority: " + value
                    + ", expected one of " + Arrays.toString(Priority.values()), e);
        }
    }
}
