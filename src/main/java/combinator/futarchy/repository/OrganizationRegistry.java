package combinator.futarchy.repository;

import combinator.futarchy.domain.organization.Organization;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 조직·키·제안자 화이트리스트 저장소
 *
 * <p>저장 엔진은 이 인터페이스 밖의 문제입니다. 구현체는 이름 유일성을 저장소 수준에서도 보장해야 합니다.
 */
public interface OrganizationRegistry {

  Optional<Organization> findById(long id);

  Optional<Organization> findByAddress(String address);

  Optional<Organization> findByName(String name);

  /** 모더레이터를 소유한 루트 조직 (브랜치는 모더레이터를 공유하므로 제외) */
  Optional<Organization> findRootByModerator(String moderatorAddress);

  List<Organization> findAll();

  /** id가 없으면 새로 발급해 저장합니다. */
  Organization save(Organization organization);

  Organization update(Organization organization);

  // ===== 관리 키 =====

  int nextKeyIndex();

  /** label은 키를 할당받은 조직 이름입니다. 조직에 연결되기 전 재시도에서 같은 키를 찾는 데 씁니다. */
  void registerKey(int keyIndex, String publicKey, String purpose, String label);

  /** 등록은 되었지만 아직 조직에 연결되지 않은 키 */
  Optional<Integer> findUnboundKey(String purpose, String label);

  void bindKey(int keyIndex, long organizationId);

  // ===== 제안자 화이트리스트 =====

  Set<String> findProposers(long organizationId);

  boolean isProposer(long organizationId, String wallet);

  void addProposer(long organizationId, String wallet, String addedBy);

  /** @return 삭제되었으면 true, 원래 없었으면 false */
  boolean removeProposer(long organizationId, String wallet);
}
