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
package io.mockaws.auth.spi.directory;

/**
 * Raised by a directory when an entity it was asked about does not exist or cannot be read
 */
public class DirectoryLookupException
        extends RuntimeException
{
    public DirectoryLookupException(String message)
    {
        super(message);
    }

    public DirectoryLookupException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
