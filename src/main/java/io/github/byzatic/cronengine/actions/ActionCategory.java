package io.github.byzatic.cronengine.actions;

import java.util.Set;

/**
 * Closed set of action categories. Each category owns the action type names it handles.
 */
public enum ActionCategory {
    CHANNELS(Set.of("channelCreate", "channelEdit", "channelDelete", "channelList", "channelInfo",
            "categoryCreate")),
    MESSAGING(Set.of("sendMessage", "react", "readMessages", "fetchMessage", "editMessage", "deleteMessage",
            "threadCreate", "pinMessage", "unpinMessage", "listPins")),
    GUILD(Set.of("memberInfo", "roleInfo", "roleAdd", "roleRemove", "searchMessages", "eventList",
            "eventCreate")),
    MODERATION(Set.of("timeout", "kick", "ban")),
    POLLS(Set.of("poll")),
    BEADS(Set.of("beadCreate", "beadUpdate", "beadClose", "beadShow", "beadList", "beadSync", "tagMapReload")),
    CRONS(Set.of("cronCreate", "cronUpdate", "cronList", "cronShow", "cronPause", "cronResume", "cronDelete",
            "cronTrigger", "cronSync"));

    private final Set<String> actionTypes;

    ActionCategory(Set<String> actionTypes) {
        this.actionTypes = actionTypes;
    }

    public Set<String> actionTypes() {
        return actionTypes;
    }
}
