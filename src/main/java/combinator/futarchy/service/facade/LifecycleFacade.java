package combinator.futarchy.service.facade;

import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.global.error.CommonErrorCode;
import combinator.futarchy.global.error.dto.ErrorResponse;
import combinator.futarchy.global.error.exception.base.BaseException;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import combinator.futarchy.global.executor.function.ThrowingSupplier;
import combinator.futarchy.global.response.ApiResponse;
import combinator.futarchy.service.liquidity.LiquidityRedemptionService;
import combinator.futarchy.service.liquidity.LiquidityReturnResult;
import combinator.futarchy.service.liquidity.LiquidityReturnService;
import combinator.futarchy.service.liquidity.RedemptionResult;
import combinator.futarchy.service.oracle.CrankResult;
import combinator.futarchy.service.oracle.OracleCrankService;
import combinator.futarchy.service.organization.CreateBranchCommand;
import combinator.futarchy.service.organization.CreateOrganizationCommand;
import combinator.futarchy.service.organization.OrganizationCreationResult;
import combinator.futarchy.service.organization.OrganizationCreationService;
import combinator.futarchy.service.proposal.CreateProposalCommand;
import combinator.futarchy.service.proposal.FinalizationResult;
import combinator.futarchy.service.proposal.ProposalCreationResult;
import combinator.futarchy.service.proposal.ProposalCreationService;
import combinator.futarchy.service.proposal.ProposalFinalizationService;
import combinator.futarchy.service.proposer.ProposerSettingsService;
import combinator.futarchy.service.query.ProposalQueryService;
import combinator.futarchy.service.query.ProposalSummary;
import combinator.futarchy.service.readiness.ReadinessReport;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * HTTP 계층에 노출하는 오케스트레이터 작업
 *
 * <p>모든 작업은 성공 데이터 또는 {@link ErrorResponse}(기계 판독 코드 + 사람이 읽는 사유)를 담은 {@link ApiResponse}를 돌려주며
 * 예외를 밖으로 던지지 않습니다. 관리되지 않은 예외는 내부 메시지를 숨긴 기본 응답으로 바뀝니다.
 */
@Service
@RequiredArgsConstructor
public class LifecycleFacade {

  private final OrganizationCreationService organizationCreationService;
  private final ProposalCreationService proposalCreationService;
  private final ProposalFinalizationService finalizationService;
  private final LiquidityRedemptionService redemptionService;
  private final LiquidityReturnService returnService;
  private final OracleCrankService oracleCrankService;
  private final ProposerSettingsService proposerSettingsService;
  private final ProposalQueryService queryService;
  private final LogicExecutor executor;

  // ===== 쓰기 작업 =====

  public ApiResponse<OrganizationCreationResult> createOrganization(
      CreateOrganizationCommand command) {
    return respond(
        () -> organizationCreationService.createRoot(command),
        "createOrganization",
        command.name());
  }

  public ApiResponse<OrganizationCreationResult> createBranch(CreateBranchCommand command) {
    return respond(
        () -> organizationCreationService.createBranch(command), "createBranch", command.name());
  }

  public ApiResponse<ProposalCreationResult> createProposal(CreateProposalCommand command) {
    return respond(
        () -> proposalCreationService.createProposal(command),
        "createProposal",
        command.organizationAddress());
  }

  public ApiResponse<ProposalCreationResult> resumeProposal(CreateProposalCommand command) {
    return respond(
        () -> proposalCreationService.resumeProposal(command),
        "resumeProposal",
        command.organizationAddress());
  }

  public ApiResponse<FinalizationResult> finalizeProposal(String proposalAddress) {
    return respond(
        () -> finalizationService.finalizeProposal(proposalAddress),
        "finalizeProposal",
        proposalAddress);
  }

  public ApiResponse<RedemptionResult> redeemLiquidity(String proposalAddress) {
    return respond(
        () -> redemptionService.redeemLiquidity(proposalAddress),
        "redeemLiquidity",
        proposalAddress);
  }

  public ApiResponse<LiquidityReturnResult> returnLiquidity(String proposalAddress) {
    return respond(
        () -> returnService.returnLiquidity(proposalAddress), "returnLiquidity", proposalAddress);
  }

  public ApiResponse<CrankResult> crankOracle(String proposalAddress) {
    return respond(
        () -> oracleCrankService.crankOracle(proposalAddress), "crankOracle", proposalAddress);
  }

  // ===== 조회 =====

  public ApiResponse<ReadinessReport> checkReadiness(
      String organizationAddress, String callerWallet) {
    return respond(
        () -> proposalCreationService.checkReadiness(organizationAddress, callerWallet),
        "checkReadiness",
        organizationAddress);
  }

  public ApiResponse<List<ProposalSummary>> listProposals(String organizationAddress) {
    return respond(
        () -> queryService.listProposals(organizationAddress),
        "listProposals",
        organizationAddress);
  }

  public ApiResponse<List<ProposalSummary>> listAllProposals() {
    return respond(queryService::listAllProposals, "listAllProposals", "");
  }

  /** 캐시에 없으면 원장 재집계로 채웁니다. */
  public ApiResponse<Long> proposalCount(String organizationAddress) {
    return respond(
        () ->
            queryService
                .cachedProposalCount(organizationAddress)
                .orElseGet(() -> (long) queryService.listProposals(organizationAddress).size()),
        "proposalCount",
        organizationAddress);
  }

  /** 진행 중인 제안이 없으면 data 없이 성공 */
  public ApiResponse<ProposalSummary> liveProposal(String organizationAddress) {
    return respond(
        () -> queryService.liveProposal(organizationAddress).orElse(null),
        "liveProposal",
        organizationAddress);
  }

  // ===== 제안자 설정 =====

  public ApiResponse<Set<String>> listProposers(String organizationAddress) {
    return respond(
        () -> proposerSettingsService.listProposers(organizationAddress),
        "listProposers",
        organizationAddress);
  }

  public ApiResponse<Void> addProposer(
      String organizationAddress, String ownerWallet, String proposerWallet) {
    return respond(
        () -> {
          proposerSettingsService.addProposer(organizationAddress, ownerWallet, proposerWallet);
          return null;
        },
        "addProposer",
        organizationAddress);
  }

  public ApiResponse<Void> removeProposer(
      String organizationAddress, String ownerWallet, String proposerWallet) {
    return respond(
        () -> {
          proposerSettingsService.removeProposer(organizationAddress, ownerWallet, proposerWallet);
          return null;
        },
        "removeProposer",
        organizationAddress);
  }

  public ApiResponse<Organization> updateProposerThreshold(
      String organizationAddress, String ownerWallet, String threshold) {
    return respond(
        () -> proposerSettingsService.updateThreshold(organizationAddress, ownerWallet, threshold),
        "updateProposerThreshold",
        organizationAddress);
  }

  public ApiResponse<Organization> updateWithdrawalPercentage(
      String organizationAddress, String ownerWallet, int percentage) {
    return respond(
        () ->
            proposerSettingsService.updateWithdrawalPercentage(
                organizationAddress, ownerWallet, percentage),
        "updateWithdrawalPercentage",
        organizationAddress);
  }

  private <T> ApiResponse<T> respond(ThrowingSupplier<T> task, String operation, String target) {
    return executor.executeOrCatch(
        () -> ApiResponse.success(task.get()),
        e -> ApiResponse.error(toErrorResponse(e)),
        TaskContext.of("Facade", operation, target));
  }

  private static ErrorResponse toErrorResponse(Throwable e) {
    if (e instanceof BaseException be) {
      return ErrorResponse.from(be);
    }
    return ErrorResponse.from(CommonErrorCode.INTERNAL_SERVER_ERROR);
  }
}
