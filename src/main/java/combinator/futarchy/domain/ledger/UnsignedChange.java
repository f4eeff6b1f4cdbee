package combinator.futarchy.domain.ledger;

import java.util.Arrays;
import java.util.Objects;

/**
 * 서명 전 원장 변경 (직렬화된 트랜잭션)
 *
 * @param instruction 로그용 작업 이름 (예: "initialize_proposal")
 * @param feePayer 수수료 지불 주소
 * @param payload 직렬화된 메시지
 * @param compacted 주소 압축 테이블을 참조하는 형식인지
 */
public record UnsignedChange(
    String instruction, String feePayer, byte[] payload, boolean compacted) {

  public UnsignedChange {
    Objects.requireNonNull(instruction, "instruction");
    payload = payload == null ? new byte[0] : payload.clone();
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof UnsignedChange other)) {
      return false;
    }
    return compacted == other.compacted
        && instruction.equals(other.instruction)
        && Objects.equals(feePayer, other.feePayer)
        && Arrays.equals(payload, other.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hash(instruction, feePayer, compacted, Arrays.hashCode(payload));
  }

  @Override
  public String toString() {
    return "UnsignedChange[" + instruction + ", payer=" + feePayer + ", " + payload.length + "B]";
  }
}
