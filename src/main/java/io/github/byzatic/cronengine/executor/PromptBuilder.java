package io.github.byzatic.cronengine.executor;

import io.github.byzatic.cronengine.schedulers.CronJob;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public final class PromptBuilder {

    private PromptBuilder() {
    }

    public static @NotNull String build(@NotNull CronJob job, @Nullable String permissionNote) {
        String channel = job.getDefinition().getChannel();
        if (channel.startsWith("#")) {
            channel = channel.substring(1);
        }
        StringBuilder sb = new StringBuilder()
                .append("You are executing a scheduled cron job named \"").append(job.getName()).append("\".\n\n")
                .append("Instruction: ").append(job.getDefinition().getPrompt()).append("\n\n")
                .append("Post your response to the channel #").append(channel).append(". ")
                .append("Keep your response concise and focused on the instruction above.");
        if (permissionNote != null && !permissionNote.isBlank()) {
            sb.append("\n\n").append(permissionNote.strip());
        }
        return sb.toString();
    }
}
