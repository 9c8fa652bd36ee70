package com.example.pipelinesync.config;

import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

import java.util.Map;

/**
 * Carries the submitting thread's MDC (correlationId) onto the worker thread,
 * and restores the worker's own context afterwards since pool threads are reused.
 */
public class MdcTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        Map<String, String> submitterContext = MDC.getCopyOfContextMap();

        return () -> {
            Map<String, String> workerContext = MDC.getCopyOfContextMap();
            try {
                if (submitterContext != null) {
                    MDC.setContextMap(submitterContext);
                } else {
                    MDC.clear();
                }
                runnable.run();
            } finally {
                if (workerContext != null) {
                    MDC.setContextMap(workerContext);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
