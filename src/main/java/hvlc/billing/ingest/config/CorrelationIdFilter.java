package hvlc.billing.ingest.config;

import hvlc.billing.ingest.util.CorrelationIdUtil;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Servlet filter that tags every request with a correlation ID.
 *
 * - Reuses the X-Correlation-ID request header when the client sends one
 * - Echoes the ID in the response header
 * - Keeps it in the MDC for the lifetime of the request, so detection and
 *   transformation logs of one upload can be grouped
 *
 * API documentation requests are logged at debug level only.
 */
@Component
@Order(1)
public class CorrelationIdFilter implements Filter {

    private static final Logger logger = LoggerFactory.getLogger(CorrelationIdFilter.class);

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final String[] DOCUMENTATION_PATHS = {"/api-docs", "/swagger-ui"};

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;
        boolean quiet = isDocumentationRequest(httpRequest.getRequestURI());

        try {
            String correlationId = resolveCorrelationId(httpRequest);
            CorrelationIdUtil.setCorrelationId(correlationId);
            httpResponse.setHeader(CORRELATION_ID_HEADER, correlationId);

            long startTime = System.currentTimeMillis();
            chain.doFilter(request, response);
            long duration = System.currentTimeMillis() - startTime;

            if (quiet) {
                logger.debug("{} {} -> {} in {}ms", httpRequest.getMethod(), httpRequest.getRequestURI(),
                        httpResponse.getStatus(), duration);
            } else {
                logger.info("{} {} -> {} in {}ms", httpRequest.getMethod(), httpRequest.getRequestURI(),
                        httpResponse.getStatus(), duration);
            }

        } catch (IOException | ServletException | RuntimeException e) {
            logger.error("Request {} {} failed", httpRequest.getMethod(), httpRequest.getRequestURI(), e);
            throw e;

        } finally {
            // Servlet threads are pooled
            CorrelationIdUtil.clearCorrelationId();
        }
    }

    private String resolveCorrelationId(HttpServletRequest request) {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.trim().isEmpty()) {
            return CorrelationIdUtil.newCorrelationId();
        }
        return correlationId.trim();
    }

    private boolean isDocumentationRequest(String uri) {
        for (String path : DOCUMENTATION_PATHS) {
            if (uri != null && uri.startsWith(path)) {
                return true;
            }
        }
        return false;
    }
}
