package personal.guestpass.access.grant.application.port.in;

/**
 * 게스트 권한 수동 회수 UseCase
 * 타이머 취소 + 레코드 삭제만 수행 (Discord 호출 없음)
 */
public interface RevokeGuestAccessUseCase {

    void revoke(String grantId);
}
