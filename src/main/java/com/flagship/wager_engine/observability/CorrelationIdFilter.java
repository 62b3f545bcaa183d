package com.flagship.wager_engine.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Opens a {@link CorrelationContext} per REST request and echoes the ID in the response.
 * Requests on a player's balance or history are also tagged with the address.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Pattern ADDRESS_PATH = Pattern.compile("^/api/(?:balance|transactions)/([A-Za-z0-9]+)");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String id = CorrelationContext.open(
            request.getHeader(CorrelationContext.CORRELATION_ID_HEADER), addressOf(request));
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, id);
        try {
            chain.doFilter(request, response);
        } finally {
            CorrelationContext.close();
        }
    }

    // WebSocket sessions outlive the handshake request; the channel handler opens its own context
    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.startsWith("/actuator") || path.startsWith("/ws/");
    }

    private static String addressOf(HttpServletRequest request) {
        Matcher m = ADDRESS_PATH.matcher(request.getRequestURI());
        return m.find() ? m.group(1) : null;
    }
}
