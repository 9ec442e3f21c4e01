package de.conciso.plantdiag.conversation;

public enum ReplyType {
    CONFIRMED,
    DENIED,
    NEW_SYMPTOM
}
