package com.sift.analyticsservice.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.sift.analytics.UserAgents;
import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("AnalyticsClientFilter")
class AnalyticsClientFilterTest {

    private final AnalyticsClientFilter filter = new AnalyticsClientFilter();

    private Set<String> sourcesSeenByHandler(MockHttpServletRequest request) throws Exception {
        var captured = new AtomicReference<Set<String>>();
        FilterChain chain = (req, resp) ->
                captured.set(AnalyticsClientFilter.sources((HttpServletRequest) req));
        filter.doFilter(request, new MockHttpServletResponse(), chain);
        return captured.get();
    }

    @Test
    @DisplayName("uses the SDK header when present")
    void clientHeader() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader(UserAgents.CLIENT_HEADER, "sift-js (v0.41.0);sift-react (v0.8.1)");
        request.addHeader("User-Agent", "Mozilla/5.0");

        assertThat(sourcesSeenByHandler(request)).containsExactly("sift-js (v0.41.0)", "sift-react (v0.8.1)");
    }

    @Test
    @DisplayName("falls back to the User-Agent header")
    void userAgent() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("User-Agent", "curl/8.4.0");

        assertThat(sourcesSeenByHandler(request)).containsExactly("curl/8.4.0");
    }

    @Test
    @DisplayName("reports 'unknown' for anonymous requests")
    void anonymous() throws Exception {
        assertThat(sourcesSeenByHandler(new MockHttpServletRequest())).containsExactly(UserAgents.UNKNOWN);
    }

    @Test
    @DisplayName("computes the labels when the filter did not run")
    void withoutFilter() {
        var request = new MockHttpServletRequest();
        request.addHeader("User-Agent", "curl/8.4.0");

        assertThat(AnalyticsClientFilter.sources(request)).containsExactly("curl/8.4.0");
    }

    @Test
    @DisplayName("ignores a foreign value stored under the attribute name")
    void foreignAttribute() {
        var request = new MockHttpServletRequest();
        request.addHeader("User-Agent", "curl/8.4.0");
        request.setAttribute(AnalyticsClientFilter.SOURCES_ATTRIBUTE, Set.of(42));

        assertThat(AnalyticsClientFilter.sources(request)).containsExactly("curl/8.4.0");
    }
}
