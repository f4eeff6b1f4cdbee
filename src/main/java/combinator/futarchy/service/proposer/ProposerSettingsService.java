package combinator.futarchy.service.proposer;

import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.global.error.exception.InvalidInputException;
import combinator.futarchy.global.error.exception.NotOrganizationOwnerException;
import combinator.futarchy.global.error.exception.ProposerNotFoundException;
import combinator.futarchy.repository.OrganizationRegistry;
import combinator.futarchy.service.organization.OrganizationResolver;
import java.math.BigInteger;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 조직 소유자 전용 제안자 설정
 *
 * <p>화이트리스트와 임계값은 조직마다 독립적입니다. 브랜치는 루트의 설정을 물려받지 않습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProposerSettingsService {

  private static final Pattern DIGITS = Pattern.compile("\\d+");

  private final OrganizationRegistry registry;
  private final OrganizationResolver resolver;

  public Set<String> listProposers(String organizationAddress) {
    Organization organization = resolver.byAddress(organizationAddress);
    return registry.findProposers(organization.id());
  }

  public void addProposer(String organizationAddress, String ownerWallet, String proposerWallet) {
    if (proposerWallet == null || proposerWallet.isBlank()) {
      throw new InvalidInputException("proposerWallet is required");
    }
    Organization organization = ownedBy(organizationAddress, ownerWallet);
    registry.addProposer(organization.id(), proposerWallet, ownerWallet);
    log.info("➕ [Proposer] {} 화이트리스트 추가: {}", organization.name(), proposerWallet);
  }

  public void removeProposer(
      String organizationAddress, String ownerWallet, String proposerWallet) {
    Organization organization = ownedBy(organizationAddress, ownerWallet);
    if (!registry.removeProposer(organization.id(), proposerWallet)) {
      throw new ProposerNotFoundException(proposerWallet);
    }
    log.info("➖ [Proposer] {} 화이트리스트 제거: {}", organization.name(), proposerWallet);
  }

  /**
   * 제안자 최소 보유량 변경
   *
   * @param threshold 기본 단위 정수 문자열. null, 빈 문자열, "0"이면 임계값을 해제합니다.
   */
  public Organization updateThreshold(
      String organizationAddress, String ownerWallet, String threshold) {
    BigInteger normalized = normalizeThreshold(threshold);
    Organization organization = ownedBy(organizationAddress, ownerWallet);
    Organization updated = registry.update(organization.withProposerThreshold(normalized));
    log.info(
        "🎚️ [Proposer] {} 임계값 변경: {}",
        organization.name(),
        normalized == null ? "해제" : normalized);
    return updated;
  }

  public Organization updateWithdrawalPercentage(
      String organizationAddress, String ownerWallet, int percentage) {
    if (percentage < Organization.MIN_WITHDRAWAL_PERCENTAGE
        || percentage > Organization.MAX_WITHDRAWAL_PERCENTAGE) {
      throw new InvalidInputException(
          "Percentage must be an integer between "
              + Organization.MIN_WITHDRAWAL_PERCENTAGE
              + " and "
              + Organization.MAX_WITHDRAWAL_PERCENTAGE);
    }
    Organization organization = ownedBy(organizationAddress, ownerWallet);
    Organization updated = registry.update(organization.withWithdrawalPercentage(percentage));
    log.info("📐 [Proposer] {} 출금 비율 변경: {}%", organization.name(), percentage);
    return updated;
  }

  static BigInteger normalizeThreshold(String threshold) {
    if (threshold == null || threshold.isEmpty() || threshold.equals("0")) {
      return null;
    }
    if (!DIGITS.matcher(threshold).matches()) {
      throw new InvalidInputException("Threshold must be a non-negative integer string");
    }
    BigInteger value = new BigInteger(threshold);
    return value.signum() == 0 ? null : value;
  }

  private Organization ownedBy(String organizationAddress, String wallet) {
    Organization organization = resolver.byAddress(organizationAddress);
    if (!organization.isOwnedBy(wallet)) {
      throw new NotOrganizationOwnerException(organization.name(), wallet);
    }
    return organization;
  }
}
