package combinator.futarchy.domain.ledger;

import java.util.List;

/** 서명이 붙은 원장 변경. 공동 서명 시 signers가 누적됩니다. */
public record SignedChange(UnsignedChange change, List<String> signers, byte[] signedPayload) {

  public SignedChange {
    signers = List.copyOf(signers);
    signedPayload = signedPayload == null ? new byte[0] : signedPayload.clone();
  }

  @Override
  public byte[] signedPayload() {
    return signedPayload.clone();
  }

  public String instruction() {
    return change.instruction();
  }
}
