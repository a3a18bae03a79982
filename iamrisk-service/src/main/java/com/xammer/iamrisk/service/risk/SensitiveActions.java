package com.xammer.iamrisk.service.risk;

import java.util.Set;

/**
 * Fixed lookup tables of IAM actions, services and AWS managed policies that warrant
 * attention during analysis.
 */
public final class SensitiveActions {

    public static final Set<String> DATA_ACTIONS = Set.of(
            "s3:GetObject",
            "s3:GetBucketAcl",
            "s3:GetBucketPolicy",
            "dynamodb:GetItem",
            "dynamodb:Query",
            "dynamodb:Scan",
            "rds:DescribeDBInstances",
            "secretsmanager:GetSecretValue",
            "ssm:GetParameter",
            "ssm:GetParametersByPath");

    public static final Set<String> ESCALATION_ACTIONS = Set.of(
            "iam:CreateRole",
            "iam:AttachRolePolicy",
            "iam:PutRolePolicy",
            "iam:AssumeRole",
            "iam:PassRole",
            "sts:AssumeRole",
            "lambda:InvokeFunction",
            "lambda:CreateFunction",
            "ec2:RunInstances");

    public static final Set<String> DESTRUCTIVE_ACTIONS = Set.of(
            "s3:DeleteBucket",
            "s3:DeleteObject",
            "dynamodb:DeleteTable",
            "rds:DeleteDBInstance",
            "ec2:TerminateInstances",
            "cloudformation:DeleteStack");

    public static final Set<String> SENSITIVE_SERVICES = Set.of(
            "secretsmanager",
            "ssm",
            "kms",
            "certificatemanager",
            "s3",
            "dynamodb",
            "rds",
            "redshift",
            "elasticsearch",
            "opensearch");

    public static final Set<String> HIGH_PRIVILEGE_POLICIES = Set.of(
            "arn:aws:iam::aws:policy/AdministratorAccess",
            "arn:aws:iam::aws:policy/PowerUserAccess",
            "arn:aws:iam::aws:policy/IAMFullAccess",
            "arn:aws:iam::aws:policy/SecurityAudit",
            "arn:aws:iam::aws:policy/ReadOnlyAccess",
            "arn:aws:iam::aws:policy/job-function/SystemAdministrator",
            "arn:aws:iam::aws:policy/job-function/NetworkAdministrator",
            "arn:aws:iam::aws:policy/job-function/DatabaseAdministrator");

    private SensitiveActions() {
    }

    public static boolean isWildcardAction(String action) {
        return "*".equals(action) || action.endsWith(":*");
    }
}
