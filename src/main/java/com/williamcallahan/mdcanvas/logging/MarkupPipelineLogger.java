package com.williamcallahan.mdcanvas.logging;

import com.williamcallahan.mdcanvas.domain.markup.ParsedMarkup;
import java.util.concurrent.atomic.AtomicLong;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs each step of the markup pipeline with timing on the {@code PIPELINE} logger.
 */
@Aspect
@Component
public class MarkupPipelineLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");
    private static final AtomicLong REQUEST_SEQUENCE = new AtomicLong();

    /**
     * Log markup parsing
     */
    @Around("execution(* com.williamcallahan.mdcanvas.service.MarkupRenderService.parse(..))")
    public Object logParse(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStep(joinPoint, "MARKUP PARSE");
    }

    /**
     * Log image rendering
     */
    @Around("execution(* com.williamcallahan.mdcanvas.service.MarkupRenderService.renderPng(..))")
    public Object logRender(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStep(joinPoint, "IMAGE RENDER");
    }

    @Around("execution(* com.williamcallahan.mdcanvas.service.MarkupRenderService.measureHeight(..))")
    public Object logMeasure(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStep(joinPoint, "HEIGHT MEASURE");
    }

    /**
     * Log click resolution
     */
    @Around("execution(* com.williamcallahan.mdcanvas.service.MarkupRenderService.resolveClick(..))"
        + " || execution(* com.williamcallahan.mdcanvas.service.MarkupRenderService.openLinkAt(..))")
    public Object logClick(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStep(joinPoint, "CLICK RESOLUTION");
    }

    private Object logStep(ProceedingJoinPoint joinPoint, String step) throws Throwable {
        String requestId = "REQ-" + REQUEST_SEQUENCE.incrementAndGet();
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] {} - Starting", requestId, step);
        Object[] args = joinPoint.getArgs();
        if (args.length > 0 && args[0] instanceof String content) {
            PIPELINE_LOG.debug("[{}] Input length: {}", requestId, content.length());
        }

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            if (result instanceof ParsedMarkup parsed) {
                PIPELINE_LOG.debug("[{}] Produced {} spans", requestId, parsed.spanCount());
            }
            PIPELINE_LOG.info("[{}] {} - Completed in {}ms", requestId, step, duration);
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] {} - Failed: {}", requestId, step, e.getMessage());
            throw e;
        }
    }
}
