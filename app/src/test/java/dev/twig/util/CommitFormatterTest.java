package dev.twig.util;

import static org.junit.jupiter.api.Assertions.*;

import dev.twig.model.Commit;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

public class CommitFormatterTest {

    private final CommitFormatter formatter = new CommitFormatter(TwigSettings.defaults(), ZoneOffset.UTC);

    private static Commit commit(String name, String description) {
        return new Commit(name, description, Instant.parse("2024-01-02T03:04:05.123456Z"), List.of("a.py"));
    }

    @Test
    public void testFormatCommit() {
        assertEquals(
                "Commit: init, Description: first import, Created at: 2024-01-02 03:04:05.123456",
                formatter.format(commit("init", "first import")));
    }

    @Test
    public void testFormatBranch() {
        var text = formatter.formatBranch("main", List.of(commit("c1", "one"), commit("c2", "two")));

        assertEquals(
                """
                Branch: main
                Commit: c1, Description: one, Created at: 2024-01-02 03:04:05.123456
                Commit: c2, Description: two, Created at: 2024-01-02 03:04:05.123456
                """,
                text);
    }

    @Test
    public void testFormatEmptyBranch() {
        assertEquals("Branch: empty\n", formatter.formatBranch("empty", List.of()));
    }

    @Test
    public void testCustomPattern() {
        var custom = new CommitFormatter(new TwigSettings(0, "yyyy/MM/dd"), ZoneOffset.UTC);

        assertTrue(custom.format(commit("c", "d")).endsWith("Created at: 2024/01/02"));
    }
}
