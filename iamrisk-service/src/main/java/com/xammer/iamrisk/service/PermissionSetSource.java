package com.xammer.iamrisk.service;

import com.xammer.iamrisk.dto.PermissionSetDetails;

import java.util.Optional;

/**
 * Supplies live permission set details for one scan. Instances hold a client and must be
 * closed.
 */
public interface PermissionSetSource extends AutoCloseable {

    /**
     * Looks up the Identity Center instance, falling back to one derived from the given
     * permission set ARN.
     */
    Optional<String> resolveInstanceArn(String samplePermissionSetArn);

    /**
     * Returns the item with its live fields merged in. Fields the API does not return keep
     * their request values.
     */
    PermissionSetDetails enrich(String instanceArn, PermissionSetDetails permissionSet);

    @Override
    void close();
}
