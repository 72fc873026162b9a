package com.jquest.api.domain.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fixed set of states a {@link Progression} can be in, as (code, label) pairs.
 */
public enum ProgressionState {
    PENDING("pending", "Pending"),
    IN_PROGRESS("in_progress", "In progress"),
    SUCCEEDED("succeeded", "Succeeded"),
    FAILED("failed", "Failed");

    private static final Map<String, ProgressionState> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ProgressionState::getCode, Function.identity()));

    private final String code;
    private final String label;

    ProgressionState(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<ProgressionState> fromCode(String code) {
        return code == null ? Optional.empty() : Optional.ofNullable(BY_CODE.get(code));
    }

    /**
     * Display label for a stored state code.
     * @param code the stored code, may be null
     * @return the label, or empty when the code is not one of the known states
     */
    public static Optional<String> labelOf(String code) {
        return fromCode(code).map(ProgressionState::getLabel);
    }
}
