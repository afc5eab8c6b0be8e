package com.warden.domain.store;

import java.util.List;

/**
 * Catalog of every table/column pair that is stored encrypted when field encryption is on.
 * Order matters: migration walks the tables in this order.
 */
public final class SensitiveTables {

    private SensitiveTables() {}

    public static final SensitiveTable GUILD_SETTINGS =
            SensitiveTable.of("guild_settings", "guild_id", "welcome_message", "join_dm_title", "join_dm_message");
    public static final SensitiveTable WARNINGS = SensitiveTable.of("warnings", "id", "reason");
    public static final SensitiveTable DELETED_MESSAGES = SensitiveTable.of("deleted_messages", "id", "content");
    public static final SensitiveTable USER_NOTES = SensitiveTable.of("user_notes", "id", "note");
    public static final SensitiveTable SCHEDULED_MESSAGES = SensitiveTable.of("scheduled_messages", "id", "message");
    public static final SensitiveTable AFK_STATUS = SensitiveTable.of("afk_status", "user_id", "message");
    public static final SensitiveTable REMINDERS = SensitiveTable.of("reminders", "id", "message");
    public static final SensitiveTable TAGS = SensitiveTable.of("tags", "id", "content");
    public static final SensitiveTable CUSTOM_COMMANDS = SensitiveTable.of("custom_commands", "id", "response");
    public static final SensitiveTable BOT_BANS = SensitiveTable.of("bot_bans", "target_id", "reason");
    public static final SensitiveTable MOD_ACTIONS = SensitiveTable.of("mod_actions", "id", "reason");
    public static final SensitiveTable MENTION_RESPONSES =
            SensitiveTable.of("mention_responses", "id", "trigger_text", "response", "image_url");
    public static final SensitiveTable REGEX_FILTERS = SensitiveTable.of("regex_filters", "id", "reason");

    private static final List<SensitiveTable> ALL = List.of(
            GUILD_SETTINGS,
            WARNINGS,
            DELETED_MESSAGES,
            USER_NOTES,
            SCHEDULED_MESSAGES,
            AFK_STATUS,
            REMINDERS,
            TAGS,
            CUSTOM_COMMANDS,
            BOT_BANS,
            MOD_ACTIONS,
            MENTION_RESPONSES,
            REGEX_FILTERS
    );

    public static List<SensitiveTable> all() {
        return ALL;
    }

    public static SensitiveTable byName(String name) {
        for (SensitiveTable t : ALL) {
            if (t.name().equals(name)) return t;
        }
        throw new IllegalArgumentException("Unknown sensitive table: " + name);
    }
}
