package com.example.pipelinesync.client;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

import java.net.ConnectException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies transport failures that are retried like a 5xx.
 */
public final class TransientErrors {

    private TransientErrors() {
    }

    public static boolean isTransient(Throwable error) {
        if (error == null) {
            return false;
        }
        Throwable unwrapped = Exceptions.unwrap(error);
        return unwrapped instanceof WebClientRequestException
                || unwrapped instanceof TimeoutException
                || unwrapped instanceof ConnectException;
    }
}
