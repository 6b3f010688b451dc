package com.modelcache.agent;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;

import java.io.IOException;

/**
 * Opens a model-load request scope around each HTTP request.
 * Register it first in the chain so every load of the request is seen.
 */
public class ModelLoadTrackingFilter implements Filter {

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest)) {
            chain.doFilter(request, response);
            return;
        }
        try (RequestScope scope = ModelLoadTracker.open(currentUrl((HttpServletRequest) request))) {
            chain.doFilter(request, response);
        }
    }

    static String currentUrl(HttpServletRequest request) {
        StringBuffer url = request.getRequestURL();
        String query = request.getQueryString();
        if (url == null) return "";
        return query == null || query.isEmpty() ? url.toString() : url + "?" + query;
    }
}
