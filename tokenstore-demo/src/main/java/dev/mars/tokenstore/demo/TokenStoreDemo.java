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
package dev.mars.tokenstore.demo;

import dev.mars.tokenstore.storage.FileTokenStore;
import dev.mars.tokenstore.storage.MergePlan;
import dev.mars.tokenstore.storage.TokenRecord;
import dev.mars.tokenstore.storage.TokenStoreConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Demo entry point for the token store.
 * <p>
 * This demonstrates basic store operations:
 * <ul>
 *   <li>Bootstrapping the store file and its salt</li>
 *   <li>Reading all records</li>
 *   <li>Adding a record with a full write</li>
 *   <li>Merging an in-memory view that carries session ids</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link TokenStoreConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (data directory only)</li>
 *   <li>System properties: {@code -Dtokenstore.dataDir=/path -Dtokenstore.cacheTtlMs=0 ...}</li>
 *   <li>Environment variables: {@code TOKENSTORE_DATA_DIR, TOKENSTORE_CACHE_TTL_MS, ...}</li>
 *   <li>Properties file: {@code tokenstore.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl tokenstore-demo -am
 *
 * # Run with default configuration
 * java -cp "tokenstore-demo/target/*:..." dev.mars.tokenstore.demo.TokenStoreDemo
 *
 * # Run with CLI data directory override
 * java ... dev.mars.tokenstore.demo.TokenStoreDemo /path/to/data
 * </pre>
 *
 * @see TokenStoreConfig
 */
public class TokenStoreDemo {

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|          Token Store Demo             |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        TokenStoreConfig config = args.length > 0 && !args[0].isBlank()
                ? TokenStoreConfig.builder().dataDir(args[0]).build()
                : TokenStoreConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        try (FileTokenStore store = new FileTokenStore(config)) {
            String salt = store.getSalt().join();
            System.out.println("[OK] Store ready at: " + store.filePath().toAbsolutePath());
            System.out.println("[OK] Salt: " + salt.substring(0, Math.min(8, salt.length())) + "...");

            List<TokenRecord> existing = store.readAll().join();
            System.out.println("[OK] Read " + existing.size() + " existing records");
            for (TokenRecord token : existing) {
                System.out.printf("    %s enable=%s%n", token, token.text("enable"));
            }

            // Add one record via full write
            TokenRecord added = TokenRecord.of(Map.of(
                    TokenRecord.KEY_FIELD, "demo-" + UUID.randomUUID(),
                    "access_token", "initial",
                    "enable", true,
                    "timestamp", System.currentTimeMillis()));
            List<TokenRecord> all = new ArrayList<>(existing);
            all.add(added);
            store.writeAll(all).join();
            System.out.println("\n[OK] Wrote " + all.size() + " records (added " + added + ")");

            // Simulate an in-memory view: refreshed access token plus a session id
            TokenRecord active = TokenRecord.of(Map.of(
                    TokenRecord.KEY_FIELD, added.refreshToken(),
                    "access_token", "refreshed",
                    TokenRecord.SESSION_FIELD, UUID.randomUUID().toString()));
            MergePlan.Outcome outcome = store.merge(List.of(active)).join();
            System.out.println("[OK] Merged in-memory view: " + outcome);

            TokenRecord stored = store.readAll().join().stream()
                    .filter(t -> added.refreshToken().equals(t.refreshToken()))
                    .findFirst()
                    .orElseThrow();
            System.out.println("\n  Stored record after merge:");
            System.out.println("    access_token = " + stored.text("access_token"));
            System.out.println("    enable       = " + stored.text("enable"));
            System.out.println("    sessionId    = " + stored.text(TokenRecord.SESSION_FIELD) + " (never persisted)");

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Token store demo complete!           |");
            System.out.println("|  Run again to see records accumulate. |");
            System.out.println("+---------------------------------------+");
        }
    }
}
