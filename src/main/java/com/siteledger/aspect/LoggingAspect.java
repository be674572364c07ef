package com.siteledger.aspect;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Method execution logging for the ledger layers.
 *
 * Automatically logs:
 * - @Service calls with parameters, outcome and execution time (INFO)
 * - Controller calls (INFO, one line each way)
 * - Repository calls (DEBUG)
 * - Slow operations (WARN)
 *
 * The pure calculators (@Component) are left out; they run once per entry
 * during full-history scans.
 */
@Aspect
@Component
public class LoggingAspect {

    private static final Logger log = LoggerFactory.getLogger(LoggingAspect.class);

    private static final long SLOW_SERVICE_MS = 1000;
    private static final long SLOW_QUERY_MS = 500;

    @Around("execution(* com.siteledger.service..*(..)) && @within(org.springframework.stereotype.Service)")
    public Object logServiceMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();

        String executionId = generateExecutionId();
        String outerExecutionId = MDC.get("executionId");
        MDC.put("executionId", executionId);

        if (log.isInfoEnabled()) {
            log.info("SERVICE CALL: {}.{}({}) [executionId={}]",
                    className, methodName, formatArguments(signature, joinPoint.getArgs()), executionId);
        }

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            log.info("✓ SUCCESS: {}.{} returned {} in {} ms",
                    className, methodName, formatParameter(result), executionTime);
            warnIfSlow(className, methodName, executionTime);
            return result;

        } catch (Exception e) {
            long executionTime = System.currentTimeMillis() - startTime;
            log.warn("✗ EXCEPTION: {}.{} threw {} after {} ms: {}",
                    className, methodName, e.getClass().getSimpleName(), executionTime, e.getMessage());
            throw e;

        } finally {
            if (outerExecutionId != null) {
                MDC.put("executionId", outerExecutionId);
            } else {
                MDC.remove("executionId");
            }
        }
    }

    /**
     * Log all controller method calls (lighter logging than services).
     */
    @Around("execution(* com.siteledger.controller..*(..))")
    public Object logControllerMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();

        log.info("→ HTTP REQUEST: {}.{}", className, methodName);

        long startTime = System.currentTimeMillis();

        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            log.info("← HTTP RESPONSE: {}.{} completed in {} ms", className, methodName, executionTime);
            return result;

        } catch (Exception e) {
            long executionTime = System.currentTimeMillis() - startTime;
            log.warn("← HTTP ERROR: {}.{} failed after {} ms - {}: {}",
                     className, methodName, executionTime, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    /**
     * Log repository method calls for debugging database operations.
     */
    @Around("execution(* com.siteledger.repository..*(..))")
    public Object logRepositoryMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();
        Object[] args = joinPoint.getArgs();

        if (log.isDebugEnabled()) {
            String params = args != null ? Arrays.stream(args)
                .map(this::formatParameter)
                .collect(Collectors.joining(", ")) : "";

            log.debug("DB CALL: {}.{}({})", className, methodName, params);
        }

        long startTime = System.currentTimeMillis();

        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;

            if (log.isDebugEnabled()) {
                log.debug("DB RETURN: {}.{} completed in {} ms", className, methodName, executionTime);
            }

            if (executionTime > SLOW_QUERY_MS) {
                log.warn("⚠ SLOW QUERY: {}.{} took {} ms", className, methodName, executionTime);
            }

            return result;

        } catch (Exception e) {
            log.debug("DB ERROR: {}.{} - {}: {}", className, methodName, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    private void warnIfSlow(String className, String methodName, long executionTime) {
        if (executionTime > SLOW_SERVICE_MS) {
            log.warn("⚠ SLOW OPERATION: {}.{} took {} ms", className, methodName, executionTime);
        }
    }

    private String formatArguments(MethodSignature signature, Object[] args) {
        if (args == null || args.length == 0) {
            return "";
        }
        String[] paramNames = signature.getParameterNames();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            String paramName = (paramNames != null && i < paramNames.length) ? paramNames[i] : "arg" + i;
            sb.append(paramName).append('=').append(formatParameter(args[i]));
        }
        return sb.toString();
    }

    /**
     * Format parameter for logging (truncate long values).
     */
    private String formatParameter(Object param) {
        if (param == null) {
            return "null";
        }

        String value = param.toString();

        if (value.length() > 100) {
            return value.substring(0, 97) + "...";
        }

        return value;
    }

    /**
     * Generate unique execution ID for tracing.
     */
    private String generateExecutionId() {
        return String.format("%d-%d", System.currentTimeMillis(), Thread.currentThread().getId());
    }
}
