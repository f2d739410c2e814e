package personal.guestpass.access.grant.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GuestRole 테스트")
class GuestRoleTest {

    private final Guild guild = new Guild("guild-1", "House Wolf", List.of(
            new GuildRole("role-guest", "Marketplace Guest"),
            new GuildRole("role-member", "Member")));

    @Test
    @DisplayName("설정된 역할 ID 가 Guild 에 있으면 ID 로 찾는다")
    void resolvesById() {
        GuestRole role = new GuestRole("role-guest", "Other Name");

        assertThat(role.resolveIn(guild)).contains(new GuildRole("role-guest", "Marketplace Guest"));
    }

    @Test
    @DisplayName("역할 ID 가 없거나 Guild 에 없으면 이름으로 찾는다")
    void fallsBackToName() {
        assertThat(new GuestRole(null, "Marketplace Guest").resolveIn(guild))
                .contains(new GuildRole("role-guest", "Marketplace Guest"));
        assertThat(new GuestRole("deleted-role", "Marketplace Guest").resolveIn(guild))
                .contains(new GuildRole("role-guest", "Marketplace Guest"));
    }

    @Test
    @DisplayName("정식 멤버로 승격되어 게스트 역할이 없으면 대상이 아니다")
    void promotedMemberDoesNotHoldRole() {
        GuestRole role = new GuestRole("role-guest", "Marketplace Guest");

        assertThat(role.isHeldBy(guild, new GuildMember("guild-1", "a", "guest", Set.of("role-guest")))).isTrue();
        assertThat(role.isHeldBy(guild, new GuildMember("guild-1", "b", "member", Set.of("role-member")))).isFalse();
    }

    @Test
    @DisplayName("Guild 에서 게스트 역할을 찾을 수 없으면 아무도 대상이 아니다")
    void unknownRoleMatchesNobody() {
        GuestRole role = new GuestRole(null, "Missing Role");

        assertThat(role.isHeldBy(guild, new GuildMember("guild-1", "a", "guest", Set.of("role-guest")))).isFalse();
    }
}
