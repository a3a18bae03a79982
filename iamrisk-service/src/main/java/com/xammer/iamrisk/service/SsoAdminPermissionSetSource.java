package com.xammer.iamrisk.service;

import com.xammer.iamrisk.dto.CustomerManagedPolicyReference;
import com.xammer.iamrisk.dto.PermissionSetDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ssoadmin.SsoAdminClient;
import software.amazon.awssdk.services.ssoadmin.model.AttachedManagedPolicy;
import software.amazon.awssdk.services.ssoadmin.model.DescribePermissionSetRequest;
import software.amazon.awssdk.services.ssoadmin.model.GetInlinePolicyForPermissionSetRequest;
import software.amazon.awssdk.services.ssoadmin.model.InstanceMetadata;
import software.amazon.awssdk.services.ssoadmin.model.ListCustomerManagedPolicyReferencesInPermissionSetRequest;
import software.amazon.awssdk.services.ssoadmin.model.ListCustomerManagedPolicyReferencesInPermissionSetResponse;
import software.amazon.awssdk.services.ssoadmin.model.ListInstancesRequest;
import software.amazon.awssdk.services.ssoadmin.model.ListInstancesResponse;
import software.amazon.awssdk.services.ssoadmin.model.ListManagedPoliciesInPermissionSetRequest;
import software.amazon.awssdk.services.ssoadmin.model.ListManagedPoliciesInPermissionSetResponse;
import software.amazon.awssdk.services.ssoadmin.model.PermissionSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class SsoAdminPermissionSetSource implements PermissionSetSource {

    private static final Logger logger = LoggerFactory.getLogger(SsoAdminPermissionSetSource.class);

    private final SsoAdminClient ssoAdminClient;

    public SsoAdminPermissionSetSource(SsoAdminClient ssoAdminClient) {
        this.ssoAdminClient = ssoAdminClient;
    }

    @Override
    public Optional<String> resolveInstanceArn(String samplePermissionSetArn) {
        try {
            ListInstancesResponse response = ssoAdminClient.listInstances(ListInstancesRequest.builder()
                    .maxResults(1)
                    .build());
            Optional<String> listed = response.instances().stream()
                    .map(InstanceMetadata::instanceArn)
                    .findFirst();
            if (listed.isPresent()) {
                return listed;
            }
        } catch (SdkException e) {
            logger.warn("Could not list SSO instances, deriving instance from permission set ARN: {}", e.getMessage());
        }
        return deriveInstanceArn(samplePermissionSetArn);
    }

    /**
     * {@code arn:aws:sso:::permissionSet/ssoins-x/ps-y} belongs to {@code arn:aws:sso:::instance/ssoins-x}.
     */
    static Optional<String> deriveInstanceArn(String permissionSetArn) {
        if (permissionSetArn == null) {
            return Optional.empty();
        }
        String[] parts = permissionSetArn.split("/");
        if (parts.length < 2 || parts[1].isBlank()) {
            return Optional.empty();
        }
        return Optional.of("arn:aws:sso:::instance/" + parts[1]);
    }

    @Override
    public PermissionSetDetails enrich(String instanceArn, PermissionSetDetails permissionSet) {
        String permissionSetArn = permissionSet.getArn();
        PermissionSet described = ssoAdminClient.describePermissionSet(DescribePermissionSetRequest.builder()
                .instanceArn(instanceArn)
                .permissionSetArn(permissionSetArn)
                .build()).permissionSet();

        List<String> managedPolicies = listManagedPolicies(instanceArn, permissionSetArn);
        List<CustomerManagedPolicyReference> customerManaged = listCustomerManagedPolicies(instanceArn, permissionSetArn);
        String inlinePolicy = ssoAdminClient.getInlinePolicyForPermissionSet(GetInlinePolicyForPermissionSetRequest.builder()
                .instanceArn(instanceArn)
                .permissionSetArn(permissionSetArn)
                .build()).inlinePolicy();

        PermissionSetDetails.PermissionSetDetailsBuilder merged = permissionSet.toBuilder()
                .managedPolicies(managedPolicies)
                .customerManagedPolicies(customerManaged);
        if (described != null) {
            if (described.name() != null) {
                merged.name(described.name());
            }
            if (described.description() != null) {
                merged.description(described.description());
            }
            if (described.sessionDuration() != null) {
                merged.sessionDuration(described.sessionDuration());
            }
        }
        if (inlinePolicy != null && !inlinePolicy.isBlank()) {
            merged.inlinePolicyDocument(inlinePolicy);
        }
        return merged.build();
    }

    private List<String> listManagedPolicies(String instanceArn, String permissionSetArn) {
        List<String> policyArns = new ArrayList<>();
        String nextToken = null;
        do {
            ListManagedPoliciesInPermissionSetRequest.Builder requestBuilder = ListManagedPoliciesInPermissionSetRequest.builder()
                    .instanceArn(instanceArn)
                    .permissionSetArn(permissionSetArn);
            if (nextToken != null) {
                requestBuilder.nextToken(nextToken);
            }
            ListManagedPoliciesInPermissionSetResponse response =
                    ssoAdminClient.listManagedPoliciesInPermissionSet(requestBuilder.build());
            response.attachedManagedPolicies().stream()
                    .map(AttachedManagedPolicy::arn)
                    .forEach(policyArns::add);
            nextToken = response.nextToken();
        } while (nextToken != null);
        return policyArns;
    }

    private List<CustomerManagedPolicyReference> listCustomerManagedPolicies(String instanceArn, String permissionSetArn) {
        List<CustomerManagedPolicyReference> references = new ArrayList<>();
        String nextToken = null;
        do {
            ListCustomerManagedPolicyReferencesInPermissionSetRequest.Builder requestBuilder =
                    ListCustomerManagedPolicyReferencesInPermissionSetRequest.builder()
                            .instanceArn(instanceArn)
                            .permissionSetArn(permissionSetArn);
            if (nextToken != null) {
                requestBuilder.nextToken(nextToken);
            }
            ListCustomerManagedPolicyReferencesInPermissionSetResponse response =
                    ssoAdminClient.listCustomerManagedPolicyReferencesInPermissionSet(requestBuilder.build());
            response.customerManagedPolicyReferences().forEach(ref ->
                    references.add(new CustomerManagedPolicyReference(ref.name(), ref.path())));
            nextToken = response.nextToken();
        } while (nextToken != null);
        return references;
    }

    @Override
    public void close() {
        ssoAdminClient.close();
    }
}
