package com.di.streamshift.storage;

import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSSessionCredentials;
import com.di.streamshift.exception.ConfigurationException;

/**
 * Renders the {@code CREDENTIALS '...'} string that lets the warehouse reach the staging bucket.
 */
public final class AwsCredentialsClause {

    private AwsCredentialsClause() {}

    /**
     * {@code aws_iam_role=<arn>} when a role is given, else key/secret (and session token) from
     * {@code provider}.
     */
    public static String render(String iamRole, AWSCredentialsProvider provider) {
        if (iamRole != null) {
            return "aws_iam_role=" + iamRole;
        }
        if (provider == null) {
            throw new ConfigurationException(
                    "No AWS credentials available: set parameter 'aws_iam_role' or configure a credentials provider");
        }
        AWSCredentials creds;
        try {
            creds = provider.getCredentials();
        } catch (RuntimeException e) {
            throw new ConfigurationException("Failed to obtain AWS credentials: " + e.getMessage(), e);
        }
        StringBuilder clause = new StringBuilder()
                .append("aws_access_key_id=").append(creds.getAWSAccessKeyId())
                .append(";aws_secret_access_key=").append(creds.getAWSSecretKey());
        if (creds instanceof AWSSessionCredentials session) {
            clause.append(";token=").append(session.getSessionToken());
        }
        return clause.toString();
    }
}
