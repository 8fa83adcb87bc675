package com.competition.gateway.util;

import org.springframework.http.server.PathContainer;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Matches request paths against the configured public path patterns
 * (e.g. {@code /api/auth/**}).
 */
public class PublicPathMatcher {

    private final List<PathPattern> patterns;

    public PublicPathMatcher(List<String> publicPaths) {
        PathPatternParser parser = PathPatternParser.defaultInstance;
        this.patterns = publicPaths.stream()
            .map(parser::parse)
            .collect(Collectors.toList());
    }

    public boolean isPublicPath(String path) {
        PathContainer pathContainer = PathContainer.parsePath(path);
        for (PathPattern pattern : patterns) {
            if (pattern.matches(pathContainer)) {
                return true;
            }
        }
        return false;
    }
}
