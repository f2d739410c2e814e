package personal.guestpass.access.grant.domain.model;

import java.util.Optional;

/**
 * 게스트 역할 식별 규칙
 * 역할 ID 가 설정되어 있고 Guild 에 존재하면 ID 로, 아니면 이름으로 찾음
 *
 * 게스트 역할을 더 이상 갖지 않은 멤버(정식 멤버로 승격 등)는 경고/퇴장 대상이 아님.
 *
 * @param id   역할 ID (선택)
 * @param name 역할 이름
 */
public record GuestRole(String id, String name) {

    public Optional<GuildRole> resolveIn(Guild guild) {
        if (id != null && !id.isBlank()) {
            Optional<GuildRole> byId = guild.findRoleById(id);
            if (byId.isPresent()) {
                return byId;
            }
        }
        return name == null || name.isBlank() ? Optional.empty() : guild.findRoleByName(name);
    }

    /**
     * 멤버가 이 Guild 에서 게스트 역할을 갖고 있는지 여부
     * Guild 에서 역할을 찾을 수 없으면 false
     */
    public boolean isHeldBy(Guild guild, GuildMember member) {
        return resolveIn(guild)
                .map(role -> member.hasRole(role.id()))
                .orElse(false);
    }
}
