package combinator.futarchy.service.organization;

import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.domain.organization.OrganizationKind;

public record OrganizationCreationResult(
    long organizationId,
    String organizationAddress,
    String name,
    OrganizationKind kind,
    String moderatorAddress,
    String adminWallet,
    String treasuryVault,
    String mintAuthorityVault,
    String submissionId) {

  static OrganizationCreationResult of(Organization saved, String submissionId) {
    return new OrganizationCreationResult(
        saved.id(),
        saved.address(),
        saved.name(),
        saved.kind(),
        saved.moderatorAddress(),
        saved.adminWallet(),
        saved.treasuryVault(),
        saved.mintAuthorityVault(),
        submissionId);
  }
}
