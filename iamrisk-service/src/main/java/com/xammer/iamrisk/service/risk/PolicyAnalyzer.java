package com.xammer.iamrisk.service.risk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.iamrisk.dto.PermissionSetDetails;
import com.xammer.iamrisk.dto.risk.PolicyAnalysisResult;
import com.xammer.iamrisk.dto.risk.ResourceType;
import com.xammer.iamrisk.dto.risk.RiskCategory;
import com.xammer.iamrisk.dto.risk.RiskFinding;
import com.xammer.iamrisk.dto.risk.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.xammer.iamrisk.service.risk.RiskFindings.details;
import static com.xammer.iamrisk.service.risk.RiskFindings.newFinding;

/**
 * Classifies a single policy: an AWS managed policy by its ARN, or an inline policy by its
 * JSON document.
 */
@Component
public class PolicyAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(PolicyAnalyzer.class);

    private static final String POLICY_TYPE_AWS_MANAGED = "AWS_MANAGED";

    /**
     * Services guessed from substrings of a managed policy name. This is a naming heuristic,
     * not the policy's real grants: managed policy documents are never fetched.
     */
    private static final List<String> NAME_HINTED_SERVICES = List.of(
            "s3", "ec2", "iam", "lambda", "rds", "dynamodb", "cloudformation", "cloudwatch");

    private final ObjectMapper objectMapper;

    public PolicyAnalyzer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Analyzes an AWS managed policy from its ARN alone. Never throws.
     */
    public PolicyAnalysisResult analyzeManagedPolicy(String policyArn) {
        try {
            String policyName = PermissionSetDetails.nameFromArn(policyArn);
            boolean admin = policyArn.contains("AdministratorAccess");

            PolicyAnalysisResult.PolicyAnalysisResultBuilder result = PolicyAnalysisResult.builder()
                    .policyArn(policyArn)
                    .policyName(policyName)
                    .permissionsCount(0)
                    .wildcardActionsCount(admin ? 1 : 0)
                    .adminPermissions(admin)
                    .crossAccountAccess(false)
                    .servicePermissions(servicesFromPolicyName(policyName));

            if (admin) {
                result.finding(newFinding()
                        .title("Administrator Access Policy")
                        .description("Policy grants full administrative access to all AWS services")
                        .riskLevel(RiskLevel.CRITICAL)
                        .category(RiskCategory.ADMINISTRATIVE_ACCESS)
                        .severity(10)
                        .impact("Complete control over AWS account and all resources")
                        .recommendation("Restrict administrative access to specific users and use temporary elevation when possible")
                        .resourceType(ResourceType.POLICY)
                        .resourceArn(policyArn)
                        .resourceName(policyName)
                        .details(details("policyType", POLICY_TYPE_AWS_MANAGED))
                        .build());
            }
            if (policyArn.contains("PowerUserAccess")) {
                result.finding(newFinding()
                        .title("Power User Access Policy")
                        .description("Policy grants broad access excluding IAM management")
                        .riskLevel(RiskLevel.HIGH)
                        .category(RiskCategory.OVERLY_PERMISSIVE)
                        .severity(7)
                        .impact("Extensive access to AWS services with limited restrictions")
                        .recommendation("Consider more specific policies based on actual job requirements")
                        .resourceType(ResourceType.POLICY)
                        .resourceArn(policyArn)
                        .resourceName(policyName)
                        .details(details("policyType", POLICY_TYPE_AWS_MANAGED))
                        .build());
            }
            return result.build();
        } catch (RuntimeException e) {
            logger.warn("Managed policy analysis failed for {}: {}", policyArn, e.getMessage());
            return emptyResult(policyArn, PermissionSetDetails.nameFromArn(policyArn));
        }
    }

    /**
     * Analyzes an inline policy document. Malformed documents are reported as a finding
     * rather than thrown.
     */
    public PolicyAnalysisResult analyzeInlinePolicy(String policyDocument, String policyName) {
        AnalysisOutcome<JsonNode> parsed = parsePolicyDocument(policyDocument);
        if (parsed.isDegraded()) {
            logger.warn("Inline policy {} could not be parsed: {}", policyName, parsed.getDegradedReason());
            return PolicyAnalysisResult.builder()
                    .policyName(policyName)
                    .finding(invalidDocumentFinding(policyName, parsed.getDegradedReason()))
                    .build();
        }

        JsonNode policy = parsed.getValue();
        JsonNode statementNode = policy.get("Statement");
        if (statementNode == null || statementNode.isNull()) {
            return PolicyAnalysisResult.builder()
                    .policyName(policyName)
                    .parsedDocument(policy)
                    .build();
        }

        List<RiskFinding> findings = new ArrayList<>();
        List<String> dataAccessPermissions = new ArrayList<>();
        Map<String, List<String>> servicePermissions = new LinkedHashMap<>();
        int permissionsCount = 0;
        int wildcardActionsCount = 0;
        boolean adminPermissions = false;
        boolean crossAccountAccess = false;

        for (JsonNode statement : asArray(statementNode)) {
            if (!statement.isObject()) {
                continue;
            }
            String effect = statement.path("Effect").asText(null);

            // Principal grants are reported whatever the Effect; actions only for Allow.
            JsonNode principal = statement.get("Principal");
            if (principal != null && principal.isObject()) {
                crossAccountAccess = true;
                findings.add(newFinding()
                        .title("Cross-Account Access Grant")
                        .description("Policy allows access from external accounts")
                        .riskLevel(RiskLevel.HIGH)
                        .category(RiskCategory.CROSS_ACCOUNT_ACCESS)
                        .severity(7)
                        .impact("Resources may be accessible from other AWS accounts")
                        .recommendation("Verify and restrict cross-account access to trusted accounts only")
                        .resourceType(ResourceType.POLICY)
                        .resourceName(policyName)
                        .details(details("principal", principal, "effect", effect))
                        .build());
            }

            if (!"Allow".equals(effect)) {
                continue;
            }

            List<String> actions = toStringList(statement.get("Action"));
            List<String> resources = toStringList(statement.get("Resource"));
            permissionsCount += actions.size();

            if (actions.contains("*")) {
                adminPermissions = true;
                findings.add(newFinding()
                        .title("Wildcard All Actions Permission")
                        .description("Policy grants access to all actions (*)")
                        .riskLevel(RiskLevel.CRITICAL)
                        .category(RiskCategory.OVERLY_PERMISSIVE)
                        .severity(10)
                        .impact("Unrestricted access to all AWS services and actions")
                        .recommendation("Replace wildcard with specific required actions")
                        .resourceType(ResourceType.POLICY)
                        .resourceName(policyName)
                        .details(details("statement", statement))
                        .build());
            }

            for (String action : actions) {
                if (SensitiveActions.isWildcardAction(action)) {
                    wildcardActionsCount++;
                }
                if (SensitiveActions.ESCALATION_ACTIONS.contains(action)) {
                    findings.add(newFinding()
                            .title("Privilege Escalation Risk")
                            .description("Policy allows privilege escalation action: " + action)
                            .riskLevel(RiskLevel.HIGH)
                            .category(RiskCategory.PRIVILEGE_ESCALATION)
                            .severity(8)
                            .impact("User may be able to escalate their privileges")
                            .recommendation("Carefully review privilege escalation permissions and add conditions where possible")
                            .resourceType(ResourceType.POLICY)
                            .resourceName(policyName)
                            .details(details("action", action, "statement", statement))
                            .build());
                }
                if (SensitiveActions.DESTRUCTIVE_ACTIONS.contains(action)) {
                    findings.add(newFinding()
                            .title("Destructive Action Permission")
                            .description("Policy allows potentially destructive action: " + action)
                            .riskLevel(RiskLevel.MEDIUM)
                            .category(RiskCategory.DATA_EXPOSURE)
                            .severity(6)
                            .impact("User can delete or modify critical resources")
                            .recommendation("Add conditions or move to break-glass access pattern")
                            .resourceType(ResourceType.POLICY)
                            .resourceName(policyName)
                            .details(details("action", action, "statement", statement))
                            .build());
                }
                if (SensitiveActions.DATA_ACTIONS.contains(action)) {
                    dataAccessPermissions.add(action);
                    findings.add(newFinding()
                            .title("Sensitive Data Access Permission")
                            .description("Policy allows reading sensitive data: " + action)
                            .riskLevel(RiskLevel.MEDIUM)
                            .category(RiskCategory.DATA_EXPOSURE)
                            .severity(6)
                            .impact("User can read data that may be confidential")
                            .recommendation("Scope data access to the specific resources required")
                            .resourceType(ResourceType.POLICY)
                            .resourceName(policyName)
                            .details(details("action", action, "statement", statement))
                            .build());
                }
                String service = action.split(":", -1)[0];
                servicePermissions.computeIfAbsent(service, key -> new ArrayList<>()).add(action);
            }

            if (resources.contains("*")) {
                findings.add(newFinding()
                        .title("Wildcard Resource Access")
                        .description("Policy grants access to all resources (*)")
                        .riskLevel(RiskLevel.HIGH)
                        .category(RiskCategory.OVERLY_PERMISSIVE)
                        .severity(7)
                        .impact("Actions can be performed on any resource in the account")
                        .recommendation("Specify explicit resource ARNs or use resource patterns")
                        .resourceType(ResourceType.POLICY)
                        .resourceName(policyName)
                        .details(details("statement", statement))
                        .build());
            }
        }

        return PolicyAnalysisResult.builder()
                .policyName(policyName)
                .parsedDocument(policy)
                .findings(findings)
                .permissionsCount(permissionsCount)
                .wildcardActionsCount(wildcardActionsCount)
                .adminPermissions(adminPermissions)
                .crossAccountAccess(crossAccountAccess)
                .dataAccessPermissions(dataAccessPermissions)
                .servicePermissions(servicePermissions)
                .build();
    }

    private AnalysisOutcome<JsonNode> parsePolicyDocument(String policyDocument) {
        if (policyDocument == null) {
            return AnalysisOutcome.degraded(null, "Policy document is empty");
        }
        try {
            JsonNode root = objectMapper.readTree(policyDocument);
            if (root == null || !root.isObject()) {
                return AnalysisOutcome.degraded(null, "Policy document must be a JSON object");
            }
            return AnalysisOutcome.success(root);
        } catch (JsonProcessingException e) {
            return AnalysisOutcome.degraded(null, e.getOriginalMessage());
        }
    }

    private RiskFinding invalidDocumentFinding(String policyName, String error) {
        return newFinding()
                .title("Invalid Policy Document")
                .description("Policy document contains invalid JSON")
                .riskLevel(RiskLevel.HIGH)
                .category(RiskCategory.SECURITY_MISCONFIGURATION)
                .severity(8)
                .impact("Policy may not function as expected")
                .recommendation("Fix JSON syntax errors in policy document")
                .resourceType(ResourceType.POLICY)
                .resourceName(policyName)
                .details(details("error", error))
                .build();
    }

    private Map<String, List<String>> servicesFromPolicyName(String policyName) {
        Map<String, List<String>> services = new LinkedHashMap<>();
        String lower = policyName.toLowerCase(Locale.ROOT);
        for (String service : NAME_HINTED_SERVICES) {
            if (lower.contains(service)) {
                services.put(service, List.of(service + ":*"));
            }
        }
        return services;
    }

    private PolicyAnalysisResult emptyResult(String policyArn, String policyName) {
        return PolicyAnalysisResult.builder()
                .policyArn(policyArn)
                .policyName(policyName != null ? policyName : "Unknown")
                .build();
    }

    private static Iterable<JsonNode> asArray(JsonNode node) {
        if (node.isArray()) {
            return node;
        }
        return List.of(node);
    }

    private static List<String> toStringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        for (JsonNode item : asArray(node)) {
            if (item.isTextual()) {
                values.add(item.asText());
            }
        }
        return values;
    }
}
