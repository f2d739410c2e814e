package personal.guestpass.access.grant.domain.model;

/**
 * Guild 역할
 */
public record GuildRole(String id, String name) {
}
