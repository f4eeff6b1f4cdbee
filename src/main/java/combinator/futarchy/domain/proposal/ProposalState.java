package combinator.futarchy.domain.proposal;

/**
 * 원장 계정에 기록된 제안 상태 (태그 합 타입)
 *
 * <p>분기는 {@link #status()}에 대한 switch 식으로 합니다. 새 상태가 추가되면 switch 식이 컴파일 오류를 내므로 누락이 없습니다.
 */
public sealed interface ProposalState
    permits ProposalState.Setup, ProposalState.Pending, ProposalState.Resolved {

  ProposalStatus status();

  static ProposalState setup() {
    return Setup.INSTANCE;
  }

  static ProposalState pending() {
    return Pending.INSTANCE;
  }

  static ProposalState resolved(int winningIndex) {
    return new Resolved(winningIndex);
  }

  /** 초기화되었지만 아직 시장이 열리지 않은 상태 */
  record Setup() implements ProposalState {
    private static final Setup INSTANCE = new Setup();

    @Override
    public ProposalStatus status() {
      return ProposalStatus.SETUP;
    }
  }

  record Pending() implements ProposalState {
    private static final Pending INSTANCE = new Pending();

    @Override
    public ProposalStatus status() {
      return ProposalStatus.PENDING;
    }
  }

  record Resolved(int winningIndex) implements ProposalState {
    public Resolved {
      if (winningIndex < 0) {
        throw new IllegalArgumentException("winningIndex must be >= 0: " + winningIndex);
      }
    }

    @Override
    public ProposalStatus status() {
      return ProposalStatus.RESOLVED;
    }
  }
}
