package eu.virtualparadox.companion.conversation;

public enum EMessageRole {
    USER,
    ASSISTANT
}
