package com.stockpipe.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationRunnerTest {

    @Test
    void buildStatements_shouldBeIdempotentDdl() {
        List<String> statements = MigrationRunner.buildStatements();

        for (String sql : statements) {
            assertTrue(sql.contains("IF NOT EXISTS"), sql);
        }
    }

    @Test
    void buildStatements_shouldDeclareNaturalKeys() {
        String all = String.join("\n", MigrationRunner.buildStatements());

        assertTrue(all.contains("CREATE TABLE IF NOT EXISTS prices"));
        assertTrue(all.contains("CREATE TABLE IF NOT EXISTS news"));
        assertTrue(all.contains("CREATE TABLE IF NOT EXISTS labels"));
        assertTrue(all.contains("CREATE TABLE IF NOT EXISTS predictions"));
        assertTrue(all.contains("CREATE TABLE IF NOT EXISTS run_log"));
        assertTrue(all.contains("url TEXT NOT NULL UNIQUE"));
        assertTrue(all.contains("CHECK (label_binary IN (0, 1))"));
        assertEquals(2, all.split("UNIQUE \\(ticker, date\\)", -1).length - 1);
    }

    @Test
    void summarizeSql_shouldCollapseWhitespaceAndTruncate() {
        assertEquals("SELECT 1 FROM x", MigrationRunner.summarizeSql("SELECT  1\n  FROM x"));
        assertEquals("-", MigrationRunner.summarizeSql("  "));
        assertEquals(180, MigrationRunner.summarizeSql("x".repeat(400)).length());
    }
}
