package com.di.streamshift.storage;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.BasicSessionCredentials;
import com.di.streamshift.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Test cases for AwsCredentialsClause.
 */
@DisplayName("AwsCredentialsClause Tests")
class AwsCredentialsClauseTest {

    @Test
    @DisplayName("Should prefer the IAM role over provider credentials")
    void testRender_IamRole() {
        AWSCredentialsProvider provider = new AWSStaticCredentialsProvider(new BasicAWSCredentials("AK", "SK"));

        assertEquals("aws_iam_role=arn:aws:iam::123:role/r", AwsCredentialsClause.render("arn:aws:iam::123:role/r", provider));
    }

    @Test
    @DisplayName("Should render access key and secret")
    void testRender_Keys() {
        AWSCredentialsProvider provider = new AWSStaticCredentialsProvider(new BasicAWSCredentials("AK", "SK"));

        assertEquals("aws_access_key_id=AK;aws_secret_access_key=SK", AwsCredentialsClause.render(null, provider));
    }

    @Test
    @DisplayName("Should append the session token for temporary credentials")
    void testRender_SessionToken() {
        AWSCredentialsProvider provider = new AWSStaticCredentialsProvider(new BasicSessionCredentials("AK", "SK", "TOKEN"));

        assertEquals("aws_access_key_id=AK;aws_secret_access_key=SK;token=TOKEN", AwsCredentialsClause.render(null, provider));
    }

    @Test
    @DisplayName("Should fail with a configuration error when no credentials can be found")
    void testRender_NoCredentials() {
        AWSCredentialsProvider provider = mock(AWSCredentialsProvider.class);
        when(provider.getCredentials()).thenThrow(new com.amazonaws.SdkClientException("Unable to load AWS credentials"));

        assertThrows(ConfigurationException.class, () -> AwsCredentialsClause.render(null, provider));
        assertThrows(ConfigurationException.class, () -> AwsCredentialsClause.render(null, null));
    }
}
