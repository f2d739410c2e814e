package personal.guestpass.access.grant.adapter.out.discord;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import personal.guestpass.access.grant.domain.model.DirectMessage;

import java.util.List;

/**
 * Discord REST API 요청/응답 DTO
 * 사용하는 필드만 매핑
 */
final class DiscordPayloads {

    private DiscordPayloads() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GuildResponse(String id, String name, List<RoleResponse> roles) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RoleResponse(String id, String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UserResponse(String id, String username) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MemberResponse(UserResponse user, String nick, List<String> roles) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChannelResponse(String id) {
    }

    record CreateDmRequest(@JsonProperty("recipient_id") String recipientId) {
    }

    record CreateMessageRequest(List<Embed> embeds) {

        static CreateMessageRequest of(DirectMessage message) {
            List<EmbedField> fields = message.fields().stream()
                    .map(field -> new EmbedField(field.name(), field.value(), false))
                    .toList();
            EmbedFooter footer = message.footer() == null ? null : new EmbedFooter(message.footer());
            return new CreateMessageRequest(List.of(new Embed(
                    message.title(),
                    message.description(),
                    message.color(),
                    fields,
                    footer)));
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Embed(String title, String description, int color, List<EmbedField> fields, EmbedFooter footer) {
    }

    record EmbedField(String name, String value, boolean inline) {
    }

    record EmbedFooter(String text) {
    }
}
