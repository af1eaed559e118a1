package io.github.chirino.access.model;

import java.util.List;

/** Well-known resource kind tags. */
public final class ResourceKinds {

    public static final String PROJECT = "project";
    public static final String ORGANIZATION = "organization";
    public static final String FEATURE_FLAG = "feature_flag";

    /** Kinds registered when no explicit registry is configured. */
    public static final List<String> DEFAULTS =
            List.of(
                    "action",
                    "activity_log",
                    "annotation",
                    "batch_export",
                    "cohort",
                    "dashboard",
                    "early_access_feature",
                    "event_definition",
                    "experiment",
                    "export",
                    FEATURE_FLAG,
                    "insight",
                    "notebook",
                    ORGANIZATION,
                    "person",
                    "plugin",
                    PROJECT,
                    "property_definition",
                    "query",
                    "session_recording",
                    "session_recording_playlist",
                    "sharing_configuration",
                    "subscription",
                    "survey",
                    "user");

    private ResourceKinds() {}

    public static boolean isMemberBased(String resource) {
        return PROJECT.equals(resource) || ORGANIZATION.equals(resource);
    }
}
