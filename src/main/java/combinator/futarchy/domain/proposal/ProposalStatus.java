package combinator.futarchy.domain.proposal;

import java.util.Locale;

public enum ProposalStatus {
  SETUP,
  PENDING,
  RESOLVED;

  /** 외부로 노출하는 소문자 이름 (setup / pending / resolved) */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
