package com.pennywise.aspect;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Method execution logging for services, controllers and repositories.
 *
 * - Services: entry with parameters at DEBUG, outcome and timing at DEBUG,
 *   failures at WARN, slow calls (over 1 s) at WARN
 * - Controllers: one line per request and response at DEBUG
 * - Repositories: DEBUG only, slow queries (over 500 ms) at WARN
 *
 * Business events themselves are logged by the services at INFO.
 */
@Aspect
@Component
public class LoggingAspect {

    private static final Logger log = LoggerFactory.getLogger(LoggingAspect.class);

    private static final long SLOW_SERVICE_MS = 1000;
    private static final long SLOW_QUERY_MS = 500;

    @Around("execution(public * com.pennywise.service..*(..))")
    public Object logServiceMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();

        if (log.isDebugEnabled()) {
            log.debug("SERVICE CALL: {}.{}({})", className, methodName, formatArguments(signature, joinPoint.getArgs()));
        }

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            log.debug("SERVICE RETURN: {}.{} -> {} in {} ms",
                    className, methodName, formatParameter(result), executionTime);
            if (executionTime > SLOW_SERVICE_MS) {
                log.warn("SLOW OPERATION: {}.{} took {} ms", className, methodName, executionTime);
            }
            return result;
        } catch (Exception e) {
            long executionTime = System.currentTimeMillis() - startTime;
            log.warn("SERVICE FAILED: {}.{} after {} ms - {}: {}",
                    className, methodName, executionTime, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    @Around("execution(* com.pennywise.controller..*(..))")
    public Object logControllerMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();

        log.debug("→ HTTP REQUEST: {}.{}", className, methodName);
        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            log.debug("← HTTP RESPONSE: {}.{} completed in {} ms",
                    className, methodName, System.currentTimeMillis() - startTime);
            return result;
        } catch (Exception e) {
            log.debug("← HTTP ERROR: {}.{} failed after {} ms - {}",
                    className, methodName, System.currentTimeMillis() - startTime, e.getClass().getSimpleName());
            throw e;
        }
    }

    @Around("execution(* com.pennywise.repository..*(..))")
    public Object logRepositoryMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();

        if (log.isDebugEnabled()) {
            String params = Arrays.stream(joinPoint.getArgs())
                    .map(this::formatParameter)
                    .collect(Collectors.joining(", "));
            log.debug("DB CALL: {}.{}({})", className, methodName, params);
        }

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            if (executionTime > SLOW_QUERY_MS) {
                log.warn("SLOW QUERY: {}.{} took {} ms", className, methodName, executionTime);
            }
            return result;
        } catch (Exception e) {
            log.debug("DB ERROR: {}.{} - {}: {}", className, methodName, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    private String formatArguments(MethodSignature signature, Object[] args) {
        if (args == null || args.length == 0) {
            return "";
        }
        String[] names = signature.getParameterNames();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            String name = (names != null && i < names.length) ? names[i] : "arg" + i;
            sb.append(name).append('=').append(isSensitive(name) ? "[REDACTED]" : formatParameter(args[i]));
        }
        return sb.toString();
    }

    private boolean isSensitive(String parameterName) {
        String lower = parameterName.toLowerCase();
        return lower.contains("password") || lower.contains("token") || lower.contains("secret");
    }

    /**
     * Format parameter for logging (truncate long values, mask sensitive data).
     */
    private String formatParameter(Object param) {
        if (param == null) {
            return "null";
        }
        String value = param.toString();
        if (value.contains("password") || value.contains("token") || value.contains("secret")) {
            return "[REDACTED]";
        }
        if (value.length() > 100) {
            return value.substring(0, 97) + "...";
        }
        return value;
    }
}
