package com.williamcallahan.docarchive.logging;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs start, completion and failure of every management command on the {@code MANAGEMENT}
 * logger, tagged with a per-run id.
 */
@Aspect
@Component
public class ManagementCommandLogger {
    private static final Logger MANAGEMENT_LOG = LoggerFactory.getLogger("MANAGEMENT");

    @Around("execution(* com.williamcallahan.docarchive.service.management.DocumentArchiver.archiveAll(..)) || "
            + "execution(* com.williamcallahan.docarchive.service.management.DocumentRenamer.renameAll(..)) || "
            + "execution(* com.williamcallahan.docarchive.service.management.SanityChecker.checkAndLog(..)) || "
            + "execution(* com.williamcallahan.docarchive.service.management.DocumentDecrypter.decryptAll(..))")
    public Object logManagementCommand(ProceedingJoinPoint joinPoint) throws Throwable {
        String runId = "CMD-" + System.currentTimeMillis() + "-" + Thread.currentThread().getId();
        String command = joinPoint.getSignature().getDeclaringType().getSimpleName()
                + "." + joinPoint.getSignature().getName();
        long startTime = System.currentTimeMillis();

        MANAGEMENT_LOG.info("[{}] {} - Starting", runId, command);
        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            MANAGEMENT_LOG.info("[{}] {} - Completed in {}ms", runId, command, duration);
            if (result != null) {
                MANAGEMENT_LOG.debug("[{}] Result: {}", runId, result);
            }
            return result;
        } catch (Exception e) {
            MANAGEMENT_LOG.error("[{}] {} - Failed: {}", runId, command, e.getMessage());
            throw e;
        }
    }
}
