package com.eainde.dialog.message;

/**
 * Author of a {@link Message}.
 */
public enum Role {
    USER,
    ASSISTANT,
    TOOL
}
