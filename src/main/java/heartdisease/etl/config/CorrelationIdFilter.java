package heartdisease.etl.config;

import heartdisease.etl.util.CorrelationIdUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every HTTP request with a correlation ID.
 *
 * Takes the X-Correlation-ID header when the client sends one, generates one otherwise,
 * echoes it in the response and removes it from MDC when the request ends.
 */
@Component
@Order(1)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(CorrelationIdFilter.class);

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        CorrelationIdUtil.setCorrelationId(correlationId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        long startTime = System.currentTimeMillis();
        try {
            logger.info("Request started: {} {}", request.getMethod(), request.getRequestURI());
            chain.doFilter(request, response);
            logger.info("Request completed: {} {} | Status: {} | Duration: {}ms",
                    request.getMethod(), request.getRequestURI(), response.getStatus(),
                    System.currentTimeMillis() - startTime);
        } finally {
            CorrelationIdUtil.clearCorrelationId();
        }
    }
}
