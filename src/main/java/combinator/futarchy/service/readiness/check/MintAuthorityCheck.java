package combinator.futarchy.service.readiness.check;

import combinator.futarchy.domain.ledger.MintAccount;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.service.readiness.ReadinessCheck;
import combinator.futarchy.service.readiness.ReadinessCheckNames;
import combinator.futarchy.service.readiness.ReadinessContext;
import combinator.futarchy.service.readiness.ReadinessResult;
import combinator.futarchy.service.sequencer.LedgerReader;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** 거버넌스 자산의 발행 권한이 조직의 발행 권한 금고에 있어야 결과를 집행할 수 있습니다. */
@Component
@Order(2)
@RequiredArgsConstructor
public class MintAuthorityCheck implements ReadinessCheck {

  private final LedgerReader reader;

  @Override
  public String name() {
    return ReadinessCheckNames.MINT_AUTHORITY;
  }

  @Override
  public ReadinessResult check(ReadinessContext context) {
    Organization organization = context.organization();
    Optional<MintAccount> mint = reader.mint(organization.governanceMint());
    if (mint.isEmpty()) {
      return ReadinessResult.notReady("Token mint not found: " + organization.governanceMint());
    }

    Optional<String> authority = mint.get().authority();
    if (authority.isEmpty()) {
      return ReadinessResult.notReady("Token mint has no mint authority (authority is null)");
    }
    if (!authority.get().equals(organization.mintAuthorityVault())) {
      return ReadinessResult.notReady(
          "Mint authority mismatch: expected "
              + organization.mintAuthorityVault()
              + ", got "
              + authority.get());
    }
    return ReadinessResult.passed();
  }
}
