package com.faceattendance.config;

import com.faceattendance.exception.ServiceNotReadyException;
import org.springframework.stereotype.Component;

/**
 * Opened once, after the embedding service and the database have both answered.
 * Core operations refuse to run while it is closed.
 */
@Component
public class ReadinessGate {

    private volatile boolean ready;

    public void markReady() {
        ready = true;
    }

    public boolean isReady() {
        return ready;
    }

    public void requireReady() {
        if (!ready) {
            throw new ServiceNotReadyException("Face attendance service is still initializing");
        }
    }
}
