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

import io.airlift.log.Logger;
import io.mockaws.auth.spi.collections.MultiMap;
import io.mockaws.auth.spi.credentials.Credential;
import io.mockaws.auth.spi.signing.RequestAuthorization;
import io.mockaws.auth.spi.signing.RequestSigner;
import io.mockaws.auth.spi.signing.SignableRequest;
import io.mockaws.auth.spi.signing.SigningFlavor;
import io.mockaws.auth.spi.signing.UnsignableRequestException;
import io.mockaws.auth.spi.timestamps.AwsTimestamp;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.signer.Aws4Signer;
import software.amazon.awssdk.auth.signer.AwsS3V4Signer;
import software.amazon.awssdk.auth.signer.params.Aws4SignerParams;
import software.amazon.awssdk.auth.signer.params.AwsS3V4SignerParams;
import software.amazon.awssdk.http.SdkHttpFullRequest;
import software.amazon.awssdk.http.SdkHttpMethod;
import software.amazon.awssdk.regions.Region;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.time.Clock;

/**
 * Computes SigV4 signatures with the AWS SDK signers, pinning the signing clock to the request's own timestamp
 */
public class AwsSdkRequestSigner
        implements RequestSigner
{
    private static final Logger log = Logger.get(AwsSdkRequestSigner.class);

    private static final String UNSIGNED_PAYLOAD = "UNSIGNED-PAYLOAD";

    private final Aws4Signer genericSigner = Aws4Signer.create();
    private final AwsS3V4Signer s3Signer = AwsS3V4Signer.create();

    @Override
    public String sign(Credential credential, String service, String region, SigningFlavor signingFlavor, SignableRequest request)
    {
        SdkHttpFullRequest requestToSign = buildRequest(request);
        AwsCredentials credentials = credential.session()
                .map(session -> (AwsCredentials) AwsSessionCredentials.create(credential.accessKey(), credential.secretKey(), session))
                .orElseGet(() -> AwsBasicCredentials.create(credential.accessKey(), credential.secretKey()));

        // because we're verifying the signature provided we must match the clock that they used
        Clock clock = Clock.fixed(request.requestDate(), AwsTimestamp.ZONE);

        SdkHttpFullRequest signedRequest = switch (signingFlavor) {
            case GENERIC -> genericSigner.sign(requestToSign, Aws4SignerParams.builder()
                    .awsCredentials(credentials)
                    .signingName(service)
                    .signingRegion(Region.of(region))
                    .doubleUrlEncode(true)
                    .signingClockOverride(clock)
                    .build());
            case S3 -> s3Signer.sign(requestToSign, AwsS3V4SignerParams.builder()
                    .enablePayloadSigning(isPayloadSigned(request.headers()))
                    .enableChunkedEncoding(false)
                    .awsCredentials(credentials)
                    .signingName(service)
                    .signingRegion(Region.of(region))
                    .doubleUrlEncode(false)
                    .signingClockOverride(clock)
                    .build());
        };

        String authorization = signedRequest.firstMatchingHeader("Authorization").orElseThrow(() -> {
            log.debug("Signer did not generate \"Authorization\" header. Request: %s %s", request.httpMethod(), request.requestUri());
            return new IllegalStateException("Signer did not generate an Authorization header");
        });
        return RequestAuthorization.parse(authorization).signature();
    }

    private static SdkHttpFullRequest buildRequest(SignableRequest request)
    {
        SdkHttpFullRequest.Builder requestBuilder = SdkHttpFullRequest.builder()
                .uri(hostAndPath(request))
                .method(httpMethod(request.httpMethod()));

        request.body().ifPresent(entityBytes -> requestBuilder.contentStreamProvider(() -> new ByteArrayInputStream(entityBytes)));

        request.headers().forEach((name, values) -> values.forEach(value -> requestBuilder.appendHeader(name, value)));

        request.queryParameters().forEach(requestBuilder::putRawQueryParameter);

        return requestBuilder.build();
    }

    private static SdkHttpMethod httpMethod(String httpMethod)
    {
        try {
            return SdkHttpMethod.fromValue(httpMethod);
        }
        catch (IllegalArgumentException e) {
            throw new UnsignableRequestException("Unsupported HTTP method: " + httpMethod, e);
        }
    }

    private static URI hostAndPath(SignableRequest request)
    {
        // the SDK derives the signed Host header from the URI, so it must carry the host the client addressed
        String host = request.headers().getFirst("host").orElse("localhost");
        String path = request.requestUri().getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        return URI.create("https://" + host + path);
    }

    private static boolean isPayloadSigned(MultiMap headers)
    {
        return headers.getFirst("x-amz-content-sha256")
                .map(contentHash -> !contentHash.equals(UNSIGNED_PAYLOAD))
                .orElse(true);
    }
}
