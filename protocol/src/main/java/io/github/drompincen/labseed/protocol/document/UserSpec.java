package io.github.drompincen.labseed.protocol.document;

/**
 * A user declared once per document. The handle {@value #CURRENT_USER} stands for the
 * authenticated account.
 */
public record UserSpec(
        String id,
        String username
) {
    public static final String CURRENT_USER = "@me";

    public boolean isCurrentUser() {
        return CURRENT_USER.equals(username);
    }

    /** Handle without the leading {@code @}. */
    public String handle() {
        if (username == null) {
            return null;
        }
        return username.startsWith("@") ? username.substring(1) : username;
    }
}
