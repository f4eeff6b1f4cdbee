package combinator.futarchy.domain.ledger;

import java.util.List;

/** 주소 압축 테이블. 주소가 한 개 이상 기록되어야 사용할 수 있습니다. */
public record LookupTableAccount(String address, List<String> addresses) {

  public LookupTableAccount {
    addresses = addresses == null ? List.of() : List.copyOf(addresses);
  }

  public boolean isPopulated() {
    return !addresses.isEmpty();
  }
}
