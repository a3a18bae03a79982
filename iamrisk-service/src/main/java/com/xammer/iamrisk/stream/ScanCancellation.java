package com.xammer.iamrisk.stream;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Stop flag shared between a running scan and the transport it writes to. The scan checks
 * it between items.
 */
public class ScanCancellation {

    private final AtomicReference<String> reason = new AtomicReference<>();

    public void cancel(String why) {
        reason.compareAndSet(null, why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }
}
