package com.example.rental.controllers;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ApiKeyFilterTest {

    private final ApiKeyFilter filter = new ApiKeyFilter(true,
            List.of("site-key:site-extra:read:availability", "admin-key:admin-extra", "broken"));

    private static MockHttpServletRequest get(String path, String key, String extra) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", path);
        if (key != null) request.addHeader(ApiKeyFilter.API_KEY_HEADER, key);
        if (extra != null) request.addHeader(ApiKeyFilter.EXTRA_HEADER, extra);
        return request;
    }

    private MockHttpServletResponse run(ApiKeyFilter f, MockHttpServletRequest request, MockFilterChain chain)
            throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        f.doFilter(request, response, chain);
        return response;
    }

    @Test
    void validClientPassesThrough() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        MockHttpServletResponse response = run(filter, get("/api/v1/availability/Canon", "site-key", "site-extra"), chain);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void missingHeadersAreUnauthorized() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        MockHttpServletResponse response = run(filter, get("/api/v1/items", "site-key", null), chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).contains("missing api key headers");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void wrongExtraIsUnauthorized() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        MockHttpServletResponse response = run(filter, get("/api/v1/items", "admin-key", "guess"), chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void permissionsRestrictEndpoints() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        MockHttpServletResponse response = run(filter, get("/api/v1/items", "site-key", "site-extra"), chain);

        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void clientWithoutPermissionsMayCallEverything() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        run(filter, get("/api/v1/items", "admin-key", "admin-extra"), chain);

        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void nonApiPathsAndDisabledCheckAreNotFiltered() throws Exception {
        MockFilterChain health = new MockFilterChain();
        run(filter, get("/actuator/health", null, null), health);
        assertThat(health.getRequest()).isNotNull();

        MockFilterChain open = new MockFilterChain();
        run(new ApiKeyFilter(false, List.of()), get("/api/v1/items", null, null), open);
        assertThat(open.getRequest()).isNotNull();
    }

    @Test
    void permissionsFollowThePath() {
        assertThat(ApiKeyFilter.requiredPermission("/api/v1/items")).isEqualTo("read:items");
        assertThat(ApiKeyFilter.requiredPermission("/api/v1/availability/DJI")).isEqualTo("read:availability");
        assertThat(ApiKeyFilter.requiredPermission("/api/v2/other")).isNull();
    }
}
