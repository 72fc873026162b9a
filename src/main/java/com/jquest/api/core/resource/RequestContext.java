package com.jquest.api.core.resource;

import jakarta.servlet.http.HttpServletRequest;
import lombok.Getter;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Collections;
import java.util.Map;

/**
 * What the projection layer needs to know about the incoming request:
 * its path (relative to the servlet context), the host it was addressed to and its body.
 */
@Getter
public class RequestContext {

    private final String path;
    private final String host;
    private final Map<String, Object> body;

    public RequestContext(String path, String host) {
        this(path, host, Collections.emptyMap());
    }

    public RequestContext(String path, String host, Map<String, Object> body) {
        this.path = path;
        this.host = stripTrailingSlash(host);
        this.body = body != null ? body : Collections.emptyMap();
    }

    public static RequestContext from(HttpServletRequest request) {
        return from(request, null);
    }

    public static RequestContext from(HttpServletRequest request, Map<String, Object> body) {
        String contextPath = request.getContextPath();
        String uri = request.getRequestURI();
        String path = StringUtils.hasLength(contextPath) && uri.startsWith(contextPath)
                ? uri.substring(contextPath.length())
                : uri;
        String host = ServletUriComponentsBuilder.fromContextPath(request)
                .replacePath(null)
                .replaceQuery(null)
                .build()
                .toUriString();
        return new RequestContext(path, host, body);
    }

    /**
     * Resolves a location against the URL of this request.
     * Absolute URLs are returned unchanged, paths starting with '/' are anchored at the host
     * and other values are resolved relative to the request path. Characters that are not
     * legal in a URL, such as spaces in stored file names, are percent-encoded.
     * @param location the location to resolve, or null for the request URL itself
     * @return the absolute URL
     */
    public String buildAbsoluteUri(String location) {
        String requestPath = path.startsWith("/") ? path : "/" + path;
        if (!StringUtils.hasLength(location)) {
            return host + requestPath;
        }
        UriComponents target = UriComponentsBuilder.fromUriString(location).build();
        if (target.getScheme() != null) {
            return location;
        }
        UriComponentsBuilder base = UriComponentsBuilder.fromUriString(host);
        if (target.getHost() != null) {
            return base.build().getScheme() + ":" + location;
        }

        String targetPath = target.getPath();
        String resolvedPath;
        if (!StringUtils.hasLength(targetPath)) {
            resolvedPath = requestPath;
        } else if (targetPath.startsWith("/")) {
            resolvedPath = targetPath;
        } else {
            resolvedPath = requestPath.substring(0, requestPath.lastIndexOf('/') + 1) + targetPath;
        }
        return base.replacePath(resolvedPath)
                .query(target.getQuery())
                .fragment(target.getFragment())
                .build()
                .normalize()
                .encode()
                .toUriString();
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
