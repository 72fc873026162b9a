package com.jquest.api.controller;

import com.jquest.api.core.resource.RequestContext;
import com.jquest.api.core.service.ResourceService;
import com.jquest.api.core.service.ResourceService.WriteResult;
import com.jquest.api.util.InputSanitizer;
import com.jquest.api.util.RequestValidator;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.config.EnableSpringDataWebSupport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * HTTP surface of every published resource, under {@code {prefix}/{api name}}.
 * List endpoints take exact-match filters as query parameters next to {@code page},
 * {@code size} and {@code sort}.
 */
@RestController
@RequestMapping("${jquest.api.prefix:/api}/${jquest.api.name:v1}")
@EnableSpringDataWebSupport(pageSerializationMode = EnableSpringDataWebSupport.PageSerializationMode.VIA_DTO)
public class ResourceController {

    private static final Logger logger = LoggerFactory.getLogger(ResourceController.class);

    /** Query parameters that are never treated as filters. */
    static final Set<String> RESERVED_PARAMS = Set.of("page", "size", "sort", "format");

    private final ResourceService resourceService;
    private final RequestValidator requestValidator;
    private final InputSanitizer inputSanitizer;

    public ResourceController(ResourceService resourceService,
                              RequestValidator requestValidator,
                              InputSanitizer inputSanitizer) {
        this.resourceService = resourceService;
        this.requestValidator = requestValidator;
        this.inputSanitizer = inputSanitizer;
    }

    @GetMapping({"", "/"})
    public ResponseEntity<Map<String, Object>> index() {
        return ResponseEntity.ok(resourceService.index());
    }

    @GetMapping("/{resource}/schema")
    public ResponseEntity<Map<String, Object>> schema(@PathVariable("resource") String resource) {
        return ResponseEntity.ok(resourceService.schema(resource));
    }

    /**
     * Lists a resource.
     * @param resource the published resource name
     * @param requestParams all query parameters, filters included
     * @param pageable pagination and sorting information
     * @return the page of projected objects
     */
    @GetMapping("/{resource}")
    public ResponseEntity<Page<Map<String, Object>>> list(
            @PathVariable("resource") String resource,
            @RequestParam Map<String, String> requestParams,
            Pageable pageable,
            HttpServletRequest request) {
        Map<String, String> filters = new LinkedHashMap<>(requestParams);
        RESERVED_PARAMS.forEach(filters::remove);
        filters = inputSanitizer.sanitizeFilters(filters);

        List<String> validationErrors = requestValidator.validatePageable(pageable);
        validationErrors.addAll(requestValidator.validateFilters(filters));
        failOn(validationErrors);

        logger.debug("List {} with filters {}", resource,
                inputSanitizer.sanitizeForLogging(filters.toString()));
        return ResponseEntity.ok(resourceService.list(resource, filters, pageable, RequestContext.from(request)));
    }

    @GetMapping("/{resource}/{id}")
    public ResponseEntity<Map<String, Object>> detail(
            @PathVariable("resource") String resource,
            @PathVariable("id") Long id,
            HttpServletRequest request) {
        failOn(requestValidator.validateId(id));
        return ResponseEntity.ok(resourceService.detail(resource, id, RequestContext.from(request)));
    }

    /**
     * Creates an object. Answers 201 with the object's URI in {@code Location};
     * the body is only sent when the resource always returns data.
     */
    @PostMapping("/{resource}")
    public ResponseEntity<Map<String, Object>> create(
            @PathVariable("resource") String resource,
            @RequestBody(required = false) Map<String, Object> payload,
            HttpServletRequest request) {
        failOn(requestValidator.validatePayload(payload));

        RequestContext context = RequestContext.from(request, payload);
        WriteResult result = resourceService.create(resource, payload, context);
        URI location = URI.create(context.buildAbsoluteUri(result.getLocation()));
        if (result.getBody() == null) {
            return ResponseEntity.created(location).build();
        }
        return ResponseEntity.created(location).body(result.getBody());
    }

    @PutMapping("/{resource}/{id}")
    public ResponseEntity<Map<String, Object>> update(
            @PathVariable("resource") String resource,
            @PathVariable("id") Long id,
            @RequestBody(required = false) Map<String, Object> payload,
            HttpServletRequest request) {
        List<String> validationErrors = requestValidator.validateId(id);
        validationErrors.addAll(requestValidator.validatePayload(payload));
        failOn(validationErrors);

        WriteResult result = resourceService.update(resource, id, payload, RequestContext.from(request, payload));
        if (result.getBody() == null) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(result.getBody());
    }

    @DeleteMapping("/{resource}/{id}")
    public ResponseEntity<Void> delete(
            @PathVariable("resource") String resource,
            @PathVariable("id") Long id) {
        failOn(requestValidator.validateId(id));
        resourceService.delete(resource, id);
        return ResponseEntity.noContent().build();
    }

    private static void failOn(List<String> validationErrors) {
        if (!validationErrors.isEmpty()) {
            throw new IllegalArgumentException(String.join(", ", validationErrors));
        }
    }
}
