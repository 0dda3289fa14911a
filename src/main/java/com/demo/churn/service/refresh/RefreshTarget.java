package com.demo.churn.service.refresh;

import java.util.Locale;

/** The upstream stored procedure a refresh runs, identified by where it lives. */
public record RefreshTarget(String server, String database, String schema, String procedure) {

    /** Case-insensitive gate key; targets that differ only in case share it. */
    public String key() {
        return String.join("|",
                lower(server), lower(database), lower(schema), lower(procedure));
    }

    public String qualifiedName() {
        return schema + "." + procedure;
    }

    private static String lower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
