/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.mockaws.auth.server.signing;

import io.mockaws.auth.spi.collections.ImmutableMultiMap;
import io.mockaws.auth.spi.collections.MultiMap;
import io.mockaws.auth.spi.credentials.Credential;
import io.mockaws.auth.spi.signing.RequestSigner;
import io.mockaws.auth.spi.signing.SignableRequest;
import io.mockaws.auth.spi.signing.SigningFlavor;
import io.mockaws.auth.spi.signing.UnsignableRequestException;
import io.mockaws.auth.spi.timestamps.AwsTimestamp;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestAwsSdkRequestSigner
{
    private static final Credential CREDENTIAL = new Credential("THIS_IS_AN_ACCESS_KEY", "THIS_IS_A_SECRET_KEY");
    private static final String SECURITY_TOKEN = "FwoGZXIvYXdzEP3//////////wEaDG79rlcAjsgKPP9N3SKIAu7/Zvngne5Ov6kGrDcIIPUZYkGpwNbj8zNnbWgOhiqmOCM3hrk4NuH17mP5n3nC7urlXZxaTCywKpAHpO3YsvLXcwjlfaYFA0Au4oejwSbU9ybIlzPzrqz7lVesgCfJOV+rj5F5UAh19d7RpRpA6Vy4nxGBTTlCNIVbkW9fp2Esql2/vsdh77rAG+j+BQegtegDCKBfen4gHMdvEOF6hyc4ne43eLXjpvUKxBgpI9MjOHtNHrDbOOBFXDDyknoESgE9Hsm12nDuVQhwrI/hhA4YB/MSIpl4FTgVs2sQP3K+v65tmyvIlpL6O78S6spMM9Tv/F4JLtksTzb90w46uZk9sxKC/RBkRijisM6tBjIrr/0znxnW3i5ggGAX4H/Z3aWlxSdzNs2UGWtqig9Plp3Xa9gG+zCKcXmDAA==";
    private static final String EMPTY_CONTENT_HASH = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

    private final RequestSigner requestSigner = new AwsSdkRequestSigner();

    @Test
    public void testRootLs()
    {
        // values discovered from an AWS CLI request sent to a dummy local HTTP server
        String xAmzDate = "20240516T024511Z";
        MultiMap headers = ImmutableMultiMap.builder(false)
                .putOrReplaceSingle("X-Amz-Date", xAmzDate)
                .putOrReplaceSingle("X-Amz-Content-SHA256", EMPTY_CONTENT_HASH)
                .putOrReplaceSingle("X-Amz-Security-Token", SECURITY_TOKEN)
                .putOrReplaceSingle("Host", "localhost:10064")
                .build();

        SignableRequest request = new SignableRequest("GET", URI.create("/"), headers, ImmutableMultiMap.empty(), Optional.empty(), AwsTimestamp.fromRequestTimestamp(xAmzDate));

        assertThat(requestSigner.sign(CREDENTIAL, "s3", "us-east-1", SigningFlavor.S3, request))
                .isEqualTo("9a19c251bf4e1533174e80da59fa57c65b3149b611ec9a4104f6944767c25704");
    }

    @Test
    public void testBucketLs()
    {
        // values discovered from an AWS CLI request sent to a dummy local HTTP server
        String xAmzDate = "20240516T034003Z";
        MultiMap headers = ImmutableMultiMap.builder(false)
                .putOrReplaceSingle("X-Amz-Date", xAmzDate)
                .putOrReplaceSingle("X-Amz-Content-SHA256", EMPTY_CONTENT_HASH)
                .putOrReplaceSingle("X-Amz-Security-Token", SECURITY_TOKEN)
                .putOrReplaceSingle("Host", "localhost:10064")
                .build();
        MultiMap queryParameters = ImmutableMultiMap.builder(true)
                .putOrReplaceSingle("list-type", "2")
                .putOrReplaceSingle("prefix", "foo/bar")
                .putOrReplaceSingle("delimiter", "/")
                .putOrReplaceSingle("encoding-type", "url")
                .build();

        SignableRequest request = new SignableRequest("GET", URI.create("/mybucket"), headers, queryParameters, Optional.empty(), AwsTimestamp.fromRequestTimestamp(xAmzDate));

        assertThat(requestSigner.sign(CREDENTIAL, "s3", "us-east-1", SigningFlavor.S3, request))
                .isEqualTo("222d7b7fcd4d5560c944e8fecd9424ee3915d131c3ad9e000d65db93e87946c4");
    }

    @Test
    public void testGenericVanillaGet()
    {
        // "get-vanilla" case of the AWS Signature Version 4 test suite
        String xAmzDate = "20150830T123600Z";
        MultiMap headers = ImmutableMultiMap.builder(false)
                .putOrReplaceSingle("Host", "example.amazonaws.com")
                .putOrReplaceSingle("X-Amz-Date", xAmzDate)
                .build();

        SignableRequest request = new SignableRequest("GET", URI.create("/"), headers, ImmutableMultiMap.empty(), Optional.empty(), AwsTimestamp.fromRequestTimestamp(xAmzDate));
        Credential credential = new Credential("AKIDEXAMPLE", "wJalrXUtnFEMI/K7MDENG+bPxRfiCYEXAMPLEKEY");

        assertThat(requestSigner.sign(credential, "service", "us-east-1", SigningFlavor.GENERIC, request))
                .isEqualTo("5fa00fa31553b73ebf1942676e86291e8372ff2a2260956d9b8aae1d763fbf31");
    }

    @Test
    public void testSignatureDependsOnSecret()
    {
        String xAmzDate = "20240516T024511Z";
        MultiMap headers = ImmutableMultiMap.builder(false)
                .putOrReplaceSingle("Host", "localhost:5000")
                .putOrReplaceSingle("X-Amz-Date", xAmzDate)
                .build();
        SignableRequest request = new SignableRequest("GET", URI.create("/"), headers, ImmutableMultiMap.empty(), Optional.empty(), AwsTimestamp.fromRequestTimestamp(xAmzDate));

        String signature = requestSigner.sign(CREDENTIAL, "iam", "us-east-1", SigningFlavor.GENERIC, request);
        assertThat(requestSigner.sign(CREDENTIAL, "iam", "us-east-1", SigningFlavor.GENERIC, request)).isEqualTo(signature);
        assertThat(requestSigner.sign(new Credential(CREDENTIAL.accessKey(), "OTHER_SECRET"), "iam", "us-east-1", SigningFlavor.GENERIC, request)).isNotEqualTo(signature);
        assertThat(requestSigner.sign(CREDENTIAL, "sts", "us-east-1", SigningFlavor.GENERIC, request)).isNotEqualTo(signature);
    }

    @Test
    public void testUnknownHttpMethod()
    {
        String xAmzDate = "20240516T024511Z";
        MultiMap headers = ImmutableMultiMap.builder(false)
                .putOrReplaceSingle("Host", "localhost:5000")
                .putOrReplaceSingle("X-Amz-Date", xAmzDate)
                .build();
        SignableRequest request = new SignableRequest("PROPFIND", URI.create("/"), headers, ImmutableMultiMap.empty(), Optional.empty(), AwsTimestamp.fromRequestTimestamp(xAmzDate));

        assertThatThrownBy(() -> requestSigner.sign(CREDENTIAL, "iam", "us-east-1", SigningFlavor.GENERIC, request))
                .isInstanceOf(UnsignableRequestException.class)
                .hasMessage("Unsupported HTTP method: PROPFIND");
    }
}
