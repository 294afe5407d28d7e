package com.sift.analyticsservice.web;

import com.sift.analytics.UserAgents;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Set;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that resolves the client labels of every HTTP request.
 *
 * <p>Labels come from {@value UserAgents#CLIENT_HEADER}, falling back to {@code User-Agent}. They
 * are stored as a request attribute so handlers can pass them along with the analytics events
 * they publish.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class AnalyticsClientFilter extends OncePerRequestFilter {

    public static final String SOURCES_ATTRIBUTE = AnalyticsClientFilter.class.getName() + ".sources";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        request.setAttribute(SOURCES_ATTRIBUTE, new ClientSources(extract(request)));
        filterChain.doFilter(request, response);
    }

    /**
     * Client labels of a request, computing them if the filter did not run.
     */
    public static Set<String> sources(HttpServletRequest request) {
        if (request.getAttribute(SOURCES_ATTRIBUTE) instanceof ClientSources sources) {
            return sources.labels();
        }
        return extract(request);
    }

    private static Set<String> extract(HttpServletRequest request) {
        return UserAgents.extract(
                request.getHeader(UserAgents.CLIENT_HEADER), request.getHeader(HttpHeaders.USER_AGENT));
    }

    private record ClientSources(Set<String> labels) {
    }
}
