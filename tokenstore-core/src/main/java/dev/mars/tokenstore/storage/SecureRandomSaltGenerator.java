/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
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
package dev.mars.tokenstore.storage;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Default {@link SaltGenerator}: 16 bytes from {@link SecureRandom}, hex encoded.
 */
public final class SecureRandomSaltGenerator implements SaltGenerator {

    private static final int SALT_BYTES = 16;

    private final SecureRandom random;

    public SecureRandomSaltGenerator() {
        this(new SecureRandom());
    }

    public SecureRandomSaltGenerator(SecureRandom random) {
        this.random = random;
    }

    @Override
    public String generateSalt() {
        byte[] bytes = new byte[SALT_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
