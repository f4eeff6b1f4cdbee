package combinator.futarchy.service.proposal;

import java.util.List;

/**
 * 제안 생성 요청
 *
 * @param callerWallet 제안자 (서명 검증은 호출 측 책임)
 * @param options 옵션 이름 (2~6개, 0번이 기본 옵션)
 * @param lengthSeconds 진행 기간
 * @param warmupSeconds 오라클 워밍업 기간 (진행 기간의 80% 이하)
 */
public record CreateProposalCommand(
    String organizationAddress,
    String callerWallet,
    String title,
    String description,
    List<String> options,
    long lengthSeconds,
    long warmupSeconds) {

  public CreateProposalCommand {
    options = options == null ? List.of() : List.copyOf(options);
  }
}
