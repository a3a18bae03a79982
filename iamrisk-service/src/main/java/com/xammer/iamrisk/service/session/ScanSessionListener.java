package com.xammer.iamrisk.service.session;

import com.xammer.iamrisk.domain.ScanSession;

@FunctionalInterface
public interface ScanSessionListener {

    /**
     * @param session a snapshot of the scope's current session, or {@code null} after a reset
     */
    void onSessionChanged(ScanSession session);
}
