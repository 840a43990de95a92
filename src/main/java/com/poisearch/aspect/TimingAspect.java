package com.poisearch.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Measures {@link Timed} operations. The last duration measured on the current
 * thread is kept for the controller to report as elapsed time.
 */
@Aspect
@Component
@Slf4j
public class TimingAspect {

    private static final ThreadLocal<Long> EXECUTION_TIME = new ThreadLocal<>();

    @Around("@annotation(timed)")
    public Object measureExecutionTime(ProceedingJoinPoint joinPoint, Timed timed) throws Throwable {
        String operation = timed.value().isEmpty() ? joinPoint.getSignature().getName() : timed.value();
        long startTime = System.nanoTime();
        
        try {
            Object result = joinPoint.proceed();
            long durationMicros = (System.nanoTime() - startTime) / 1_000;
            EXECUTION_TIME.set(durationMicros);
            
            if (timed.logLevel() == Timed.LogLevel.INFO) {
                log.info("{} completed in {}us", operation, durationMicros);
            } else {
                log.debug("{} completed in {}us", operation, durationMicros);
            }
            return result;
        } catch (Throwable e) {
            long durationMicros = (System.nanoTime() - startTime) / 1_000;
            EXECUTION_TIME.set(durationMicros);
            log.debug("{} failed after {}us: {}", operation, durationMicros, e.toString());
            throw e;
        }
    }
    
    /**
     * Elapsed time of the last timed operation on this thread, formatted in seconds, then cleared
     */
    public static String getAndClearExecutionTime() {
        Long durationMicros = EXECUTION_TIME.get();
        EXECUTION_TIME.remove();
        if (durationMicros == null) {
            return "0.000000s";
        }
        return String.format(Locale.ROOT, "%.6fs", durationMicros / 1_000_000.0);
    }
}
