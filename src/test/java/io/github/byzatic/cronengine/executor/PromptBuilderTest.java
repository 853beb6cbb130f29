package io.github.byzatic.cronengine.executor;

import io.github.byzatic.cronengine.schedulers.CronJob;
import io.github.byzatic.cronengine.schedulers.JobDefinition;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    private static CronJob job(String channel) {
        return new CronJob("j", "cron-1", null, "g", "Weekly digest",
                new JobDefinition("0 8 * * 1", null, channel, "List open issues"));
    }

    @Test
    void build_includesNameInstructionAndChannel() {
        String prompt = PromptBuilder.build(job("#dev"), null);

        assertEquals("You are executing a scheduled cron job named \"Weekly digest\".\n\n"
                + "Instruction: List open issues\n\n"
                + "Post your response to the channel #dev. "
                + "Keep your response concise and focused on the instruction above.", prompt);
    }

    @Test
    void build_appendsPermissionNote() {
        String prompt = PromptBuilder.build(job("dev"), "  You may only read files.  ");

        assertTrue(prompt.contains("channel #dev."));
        assertTrue(prompt.endsWith("above.\n\nYou may only read files."));
    }

    @Test
    void build_ignoresBlankPermissionNote() {
        assertEquals(PromptBuilder.build(job("dev"), null), PromptBuilder.build(job("dev"), "   "));
    }
}
