package com.jquest.api.util;

import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shape checks on request input, run by the controller before calling the service.
 * Every method returns the list of problems found, empty when the input is acceptable.
 */
@Component
public class RequestValidator {

    static final int MAX_PAGE_SIZE = 1000;

    public List<String> validateFilters(Map<String, String> filters) {
        List<String> errors = new ArrayList<>();
        if (filters != null) {
            filters.forEach((key, value) -> {
                if (!StringUtils.hasText(key)) {
                    errors.add("Filter key cannot be empty");
                }
                if (!StringUtils.hasText(value)) {
                    errors.add("Filter value cannot be empty for key: " + key);
                }
            });
        }
        return errors;
    }

    public List<String> validateId(Long id) {
        List<String> errors = new ArrayList<>();
        if (id == null) {
            errors.add("ID cannot be null");
        } else if (id <= 0) {
            errors.add("ID must be positive");
        }
        return errors;
    }

    /**
     * A write payload must be a non-null JSON object.
     */
    public List<String> validatePayload(Map<String, Object> payload) {
        List<String> errors = new ArrayList<>();
        if (payload == null) {
            errors.add("Request body cannot be empty");
        }
        return errors;
    }

    public List<String> validatePageable(Pageable pageable) {
        List<String> errors = new ArrayList<>();
        if (pageable == null) {
            errors.add("Pageable cannot be null");
            return errors;
        }
        if (pageable.isUnpaged()) {
            return errors;
        }
        if (pageable.getPageNumber() < 0) {
            errors.add("Page number cannot be negative");
        }
        if (pageable.getPageSize() <= 0) {
            errors.add("Page size must be positive");
        } else if (pageable.getPageSize() > MAX_PAGE_SIZE) {
            errors.add("Page size cannot exceed " + MAX_PAGE_SIZE);
        }
        return errors;
    }
}
