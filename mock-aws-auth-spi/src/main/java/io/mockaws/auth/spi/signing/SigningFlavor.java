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
package io.mockaws.auth.spi.signing;

public enum SigningFlavor
{
    /**
     * Standard SigV4 as used by query/JSON services (IAM, STS, EC2, ...)
     */
    GENERIC,
    /**
     * SigV4 variant used by S3: the path is encoded once and the payload hash
     * travels in {@code x-amz-content-sha256}
     */
    S3,
}
