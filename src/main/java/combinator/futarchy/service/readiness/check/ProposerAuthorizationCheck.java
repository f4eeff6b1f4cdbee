package combinator.futarchy.service.readiness.check;

import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.repository.OrganizationRegistry;
import combinator.futarchy.service.readiness.ReadinessCheck;
import combinator.futarchy.service.readiness.ReadinessCheckNames;
import combinator.futarchy.service.readiness.ReadinessContext;
import combinator.futarchy.service.readiness.ReadinessResult;
import combinator.futarchy.service.sequencer.LedgerReader;
import java.math.BigInteger;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 제안자 권한
 *
 * <p>화이트리스트 확인은 원격 호출이 없고, 임계값이 설정된 경우에만 잔액을 한 번 조회합니다. 화이트리스트도 임계값도 없는 조직은 누구나 제안할 수
 * 있습니다.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class ProposerAuthorizationCheck implements ReadinessCheck {

  private final OrganizationRegistry registry;
  private final LedgerReader reader;

  @Override
  public String name() {
    return ReadinessCheckNames.PROPOSER_AUTHORIZATION;
  }

  @Override
  public ReadinessResult check(ReadinessContext context) {
    Organization organization = context.organization();
    String caller = context.callerWallet();
    Set<String> whitelist = registry.findProposers(organization.id());
    Optional<BigInteger> threshold = organization.threshold();

    if (whitelist.isEmpty() && threshold.isEmpty()) {
      log.debug("[Readiness] {} 제안자 제한 없음: {}", organization.name(), caller);
      return ReadinessResult.passed();
    }
    if (whitelist.contains(caller)) {
      log.debug("[Readiness] {} 화이트리스트로 승인: {}", organization.name(), caller);
      return ReadinessResult.passed();
    }
    if (threshold.isEmpty()) {
      return ReadinessResult.notReady("Wallet not on proposer whitelist for this organization");
    }
    return checkBalance(caller, organization.governanceMint(), threshold.get());
  }

  private ReadinessResult checkBalance(String caller, String mint, BigInteger required) {
    Optional<BigInteger> balance = reader.tokenBalance(caller, mint);
    if (balance.isEmpty()) {
      return ReadinessResult.notReady(
          "Wallet not whitelisted and no token balance (required: " + required + ")");
    }
    if (balance.get().compareTo(required) < 0) {
      return ReadinessResult.notReady(
          "Wallet not whitelisted and token balance ("
              + balance.get()
              + ") is below required threshold ("
              + required
              + ")");
    }
    return ReadinessResult.passed();
  }
}
