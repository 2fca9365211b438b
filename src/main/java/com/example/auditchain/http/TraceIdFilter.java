package com.example.auditchain.http;

import com.example.auditchain.util.TraceIds;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the trace id for every request: the caller's {@code X-Trace-Id} when it is well formed,
 * a freshly generated one otherwise. Exposed as a request attribute, a response header and the
 * {@code traceId} MDC key.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Trace-Id";
    public static final String ATTRIBUTE = "auditchain.traceId";

    private final Clock clock;

    public TraceIdFilter(Clock clock) {
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        String traceId = req.getHeader(HEADER);
        if (!TraceIds.isValid(traceId)) {
            traceId = TraceIds.generate(clock);
        }
        req.setAttribute(ATTRIBUTE, traceId);
        MDC.put("traceId", traceId);
        res.setHeader(HEADER, traceId);
        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove("traceId");
        }
    }
}
