package personal.guestpass.access.grant.domain.model;

import java.util.List;

/**
 * 게스트에게 보내는 DM (Discord embed 한 개로 전송)
 */
public record DirectMessage(
        String title,
        String description,
        int color,
        List<Field> fields,
        String footer) {

    public DirectMessage {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public record Field(String name, String value) {
    }
}
