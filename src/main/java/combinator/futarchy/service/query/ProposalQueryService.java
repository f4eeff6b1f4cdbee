package combinator.futarchy.service.query;

import combinator.futarchy.config.FutarchyProperties;
import combinator.futarchy.domain.ledger.ModeratorAccount;
import combinator.futarchy.domain.organization.Organization;
import combinator.futarchy.domain.proposal.ProposalAccount;
import combinator.futarchy.domain.proposal.ProposalMetadata;
import combinator.futarchy.domain.proposal.ProposalStatus;
import combinator.futarchy.external.metadata.MetadataStore;
import combinator.futarchy.external.metadata.ProposalMetadataCodec;
import combinator.futarchy.global.cache.CacheKeys;
import combinator.futarchy.global.cache.ReadModelCache;
import combinator.futarchy.global.error.exception.OrganizationMisconfiguredException;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import combinator.futarchy.repository.OrganizationRegistry;
import combinator.futarchy.service.organization.OrganizationResolver;
import combinator.futarchy.service.projection.ProposalProjection;
import combinator.futarchy.service.projection.ProposalStateProjector;
import combinator.futarchy.service.sequencer.LedgerReader;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 제안 조회 (원장 전체 스캔 + 캐시)
 *
 * <p>조직별 제안 수는 스캔할 때마다 덮어쓰고, 전체 목록은 짧은 TTL로 캐시합니다. 캐시 미스는 항상 재스캔으로 이어집니다.
 *
 * <p>제안 수는 두 스캔 모두 launch된 제안(SETUP 제외)만 셉니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProposalQueryService {

  private final OrganizationRegistry registry;
  private final OrganizationResolver resolver;
  private final LedgerReader reader;
  private final ProposalStateProjector projector;
  private final MetadataStore metadataStore;
  private final ProposalMetadataCodec codec;
  private final ReadModelCache cache;
  private final LogicExecutor executor;
  private final Clock clock;
  private final FutarchyProperties properties;

  /**
   * 조직 소유 제안 목록 (최신순). 같은 모더레이터를 쓰는 다른 조직의 제안은 메타데이터로 걸러냅니다.
   *
   * <p>이어서 만들 수 있도록 SETUP 제안도 목록에는 포함하지만 제안 수에는 넣지 않습니다.
   */
  public List<ProposalSummary> listProposals(String organizationAddress) {
    Organization organization = resolver.byAddress(organizationAddress);
    Instant now = clock.instant();

    List<ProposalSummary> summaries = new ArrayList<>();
    for (ProposalAccount account : scan(moderatorOf(organization))) {
      metadataOf(account)
          .filter(metadata -> metadata.belongsTo(organizationAddress))
          .ifPresent(
              metadata ->
                  summaries.add(
                      ProposalSummary.of(account, projector.project(account, now), metadata)));
    }
    summaries.sort(Comparator.comparingLong(ProposalSummary::proposalId).reversed());

    long launched = summaries.stream().filter(p -> p.status() != ProposalStatus.SETUP).count();
    cache.set(CacheKeys.proposalCount(organizationAddress), launched);
    return summaries;
  }

  /**
   * 전체 조직의 제안 목록. SETUP 제안과 소유 조직을 확인할 수 없는 제안은 제외합니다.
   *
   * <p>모더레이터 계정을 읽을 수 없는 루트는 경고만 남기고 건너뜁니다.
   */
  public List<ProposalSummary> listAllProposals() {
    Optional<AllProposals> cached = cache.get(CacheKeys.ALL_PROPOSALS, AllProposals.class);
    if (cached.isPresent()) {
      return cached.get().proposals();
    }

    Instant now = clock.instant();
    Map<String, Organization> byAddress = new HashMap<>();
    Map<String, Long> counts = new LinkedHashMap<>();
    for (Organization organization : registry.findAll()) {
      byAddress.put(organization.address(), organization);
      counts.put(organization.address(), 0L);
    }

    List<ProposalSummary> summaries = new ArrayList<>();
    for (Organization root : registry.findAll()) {
      if (!root.isRoot() || root.moderatorAddress() == null) {
        continue;
      }
      Optional<ModeratorAccount> moderator = reader.moderator(root.moderatorAddress());
      if (moderator.isEmpty()) {
        log.warn(
            "⚠️ [Query] {} 모더레이터 계정 없음, 전체 목록에서 제외: {}",
            root.label(),
            root.moderatorAddress());
        continue;
      }
      for (ProposalAccount account : scan(moderator.get())) {
        if (account.status() == ProposalStatus.SETUP) {
          continue;
        }
        Optional<ProposalMetadata> metadata =
            metadataOf(account)
                .filter(m -> isUnderModerator(byAddress.get(m.organizationAddress()), root));
        if (metadata.isEmpty()) {
          continue;
        }
        summaries.add(ProposalSummary.of(account, projector.project(account, now), metadata.get()));
        counts.merge(metadata.get().organizationAddress(), 1L, Long::sum);
      }
    }
    summaries.sort(Comparator.comparingLong(ProposalSummary::createdAt).reversed());

    counts.forEach((address, count) -> cache.set(CacheKeys.proposalCount(address), count));
    cache.set(
        CacheKeys.ALL_PROPOSALS,
        new AllProposals(summaries),
        properties.getCache().getListTtl());
    log.debug("📋 [Query] 전체 제안 {}건 재집계", summaries.size());
    return List.copyOf(summaries);
  }

  /** 캐시에 있는 조직별 제안 수. 한 번도 집계하지 않았으면 empty */
  public Optional<Long> cachedProposalCount(String organizationAddress) {
    return cache.get(CacheKeys.proposalCount(organizationAddress), Long.class);
  }

  /** 모더레이터의 최근 제안이 진행 중(PENDING, 미만료)이면 그 요약 */
  public Optional<ProposalSummary> liveProposal(String organizationAddress) {
    Organization organization = resolver.byAddress(organizationAddress);
    Optional<ProposalAccount> latest = reader.latestProposal(moderatorOf(organization));
    if (latest.isEmpty()) {
      return Optional.empty();
    }
    ProposalProjection projection = projector.project(latest.get(), clock.instant());
    if (!projection.isActive()) {
      return Optional.empty();
    }
    return metadataOf(latest.get())
        .map(metadata -> ProposalSummary.of(latest.get(), projection, metadata));
  }

  private ModeratorAccount moderatorOf(Organization organization) {
    return reader
        .moderator(organization.moderatorAddress())
        .orElseThrow(
            () -> new OrganizationMisconfiguredException(organization.label(), "moderatorAddress"));
  }

  /** id 0부터 카운터 직전까지. 닫힌 계정은 건너뜁니다. */
  private List<ProposalAccount> scan(ModeratorAccount moderator) {
    List<ProposalAccount> accounts = new ArrayList<>();
    for (long id = 0; id < moderator.proposalIdCounter(); id++) {
      reader.proposal(moderator.address(), id).ifPresent(accounts::add);
    }
    return accounts;
  }

  /** 메타데이터를 가져올 수 없거나 해석할 수 없으면 empty */
  private Optional<ProposalMetadata> metadataOf(ProposalAccount account) {
    String reference = account.metadataRef();
    if (reference == null || reference.isBlank()) {
      return Optional.empty();
    }
    return executor.executeOrDefault(
        () -> metadataStore.fetch(reference).map(blob -> codec.decode(blob, reference)),
        Optional.empty(),
        TaskContext.of("Metadata", "fetch", reference));
  }

  private static boolean isUnderModerator(Organization owner, Organization root) {
    return owner != null && root.moderatorAddress().equals(owner.moderatorAddress());
  }

  private record AllProposals(List<ProposalSummary> proposals) {

    AllProposals {
      proposals = List.copyOf(proposals);
    }
  }
}
