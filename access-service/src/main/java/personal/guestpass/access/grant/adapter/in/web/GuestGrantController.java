package personal.guestpass.access.grant.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.guestpass.access.grant.adapter.in.web.dto.GrantGuestRequest;
import personal.guestpass.access.grant.adapter.in.web.dto.GuestGrantResponse;
import personal.guestpass.access.grant.application.port.in.GetGuestGrantsUseCase;
import personal.guestpass.access.grant.application.port.in.GrantGuestAccessUseCase;
import personal.guestpass.access.grant.application.port.in.RevokeGuestAccessUseCase;
import personal.guestpass.access.grant.domain.model.GrantStatus;
import personal.guestpass.access.grant.domain.model.GuestGrant;
import personal.guestpass.common.dto.ApiResponse;

import java.util.List;

/**
 * Guest Grant API Controller
 * 게스트 권한 부여 / 조회 / 수동 회수 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class GuestGrantController {

    private final GrantGuestAccessUseCase grantGuestAccessUseCase;
    private final RevokeGuestAccessUseCase revokeGuestAccessUseCase;
    private final GetGuestGrantsUseCase getGuestGrantsUseCase;

    /**
     * 게스트 권한 부여
     * POST /api/v1/guests
     */
    @PostMapping("/guests")
    public ResponseEntity<GuestGrantResponse> grant(@Valid @RequestBody GrantGuestRequest request) {
        log.info("Grant guest access: guildId={}, accountId={}", request.guildId(), request.accountId());

        GuestGrant grant = grantGuestAccessUseCase.grant(request.toCommand());

        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(grant));
    }

    /**
     * 게스트 권한 목록 조회
     * GET /api/v1/guests?status=MANUAL_REVIEW
     */
    @GetMapping("/guests")
    public ResponseEntity<List<GuestGrantResponse>> getGrants(
            @RequestParam(required = false) GrantStatus status
    ) {
        List<GuestGrantResponse> response = getGuestGrantsUseCase.getGrants(status).stream()
                .map(this::toResponse)
                .toList();

        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/v1/guests/{grantId}
     */
    @GetMapping("/guests/{grantId}")
    public ResponseEntity<GuestGrantResponse> getGrant(@PathVariable String grantId) {
        GuestGrant grant = getGuestGrantsUseCase.getGrant(grantId);
        return ResponseEntity.ok(toResponse(grant));
    }

    /**
     * 게스트 권한 수동 회수 (타이머 취소 + 레코드 삭제, Guild 퇴장은 하지 않음)
     * DELETE /api/v1/guests/{grantId}
     */
    @DeleteMapping("/guests/{grantId}")
    public ResponseEntity<ApiResponse<Void>> revoke(@PathVariable String grantId) {
        log.info("Revoke guest access: grantId={}", grantId);

        revokeGuestAccessUseCase.revoke(grantId);

        return ResponseEntity.ok(ApiResponse.success("Guest access revoked"));
    }

    private GuestGrantResponse toResponse(GuestGrant grant) {
        return GuestGrantResponse.from(grant,
                getGuestGrantsUseCase.findTimerPhase(grant.id()).orElse(null));
    }
}
