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
package io.mockaws.auth.server.security;

import io.mockaws.auth.spi.signing.SigningFlavor;

import static java.util.Objects.requireNonNull;

/**
 * Selects how a request is signed and how its failures are reported
 */
public enum AuthFlavor
{
    GENERIC(SigningFlavor.GENERIC) {
        @Override
        ErrorFlavor errorFlavor()
        {
            return new GenericErrorFlavor();
        }
    },
    S3(SigningFlavor.S3) {
        @Override
        ErrorFlavor errorFlavor()
        {
            return new S3ErrorFlavor();
        }
    };

    private final SigningFlavor signingFlavor;

    AuthFlavor(SigningFlavor signingFlavor)
    {
        this.signingFlavor = requireNonNull(signingFlavor, "signingFlavor is null");
    }

    public SigningFlavor signingFlavor()
    {
        return signingFlavor;
    }

    abstract ErrorFlavor errorFlavor();
}
