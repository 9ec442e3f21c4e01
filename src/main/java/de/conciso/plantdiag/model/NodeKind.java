package de.conciso.plantdiag.model;

import java.util.Locale;

public enum NodeKind {
    DISEASE,
    SYMPTOM,
    SOLUTION,
    OTHER;

    /** Maps a raw node {@code type} label onto a kind. Unknown labels become {@link #OTHER}. */
    public static NodeKind fromType(String type) {
        if (type == null) return OTHER;
        return switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "disease", "plantdisease" -> DISEASE;
            case "symptom" -> SYMPTOM;
            case "solution" -> SOLUTION;
            default -> OTHER;
        };
    }
}
