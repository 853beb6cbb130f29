package io.github.byzatic.cronengine.definition_sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * On-disk job definition, one JSON object per file. The file name without suffix is the job id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DefinitionFile {
    public String cronId;
    public String name;
    public String guildId;
    public String threadId;
    public String channel;
    public String prompt;
    public String schedule;
    public String timezone;
    public Boolean disabled;

    @Override
    public String toString() {
        return "DefinitionFile{cronId='" + cronId + "', name='" + name + "', guildId='" + guildId +
                "', channel='" + channel + "', schedule='" + schedule + "', timezone='" + timezone + "'}";
    }
}
