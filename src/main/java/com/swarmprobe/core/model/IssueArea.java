package com.swarmprobe.core.model;

/**
 * Area tags attached to issues. The lowercase form doubles as the tracker label.
 */
public final class IssueArea {

    private IssueArea() {}

    public static final String DEPLOY = "Deploy";
    public static final String SYNC = "Sync";
    public static final String MOVEMENT = "Movement";
    public static final String CHAT = "Chat";
    public static final String SOCIAL = "Social";
    public static final String SKILLS = "Skills";
    public static final String INTERACTABLES = "Interactables";
    public static final String AIC = "AIC";
    public static final String PERFORMANCE = "Performance";

    public static String label(String area) {
        return area.toLowerCase();
    }
}
